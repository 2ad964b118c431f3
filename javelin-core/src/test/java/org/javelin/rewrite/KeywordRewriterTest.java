package org.javelin.rewrite;

import java.util.List;

import org.javelin.SyntaxRewriteException;
import org.javelin.mapping.MappingStore;
import org.javelin.mapping.Position;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeywordRewriterTest {

    private final KeywordRewriter rewriter = new KeywordRewriter();

    private String rewrite(String source) {
        return rewriter.rewrite(source, List.of()).source();
    }

    @Test
    void untypedLet_becomesFinalVar() {
        assertThat(rewrite("let x = 1;")).isEqualTo("final var x = 1;");
    }

    @Test
    void typedLet_becomesFinalDeclaration() {
        assertThat(rewrite("let x: int = 1;")).isEqualTo("final int x = 1;");
        assertThat(rewrite("let totals: Map<String, Integer> = new HashMap<>();"))
            .isEqualTo("final Map<String, Integer> totals = new HashMap<>();");
    }

    @Test
    void letInEnhancedFor_becomesFinalVar() {
        assertThat(rewrite("for (let item : items) { use(item); }"))
            .isEqualTo("for (final var item : items) { use(item); }");
    }

    @Test
    void letInsideLiteralsCommentsAndIdentifiers_isUntouched() {
        String source = "String let = \"let x = 1;\"; // let y = 2;\nint letter = let.length();";

        assertThat(rewrite(source)).isEqualTo(source);
    }

    @Test
    void typedLetWithoutInitializer_isRejected() {
        assertThatThrownBy(() -> rewrite("{\n  let x: int;\n}"))
            .isInstanceOf(SyntaxRewriteException.class)
            .satisfies(e -> {
                SyntaxRewriteException se = (SyntaxRewriteException) e;
                assertThat(se.getRewriter()).isEqualTo("keywords");
                assertThat(se.getLine()).isEqualTo(2);
                assertThat(se.getColumn()).isEqualTo(3);
            });
    }

    @Test
    void boundName_mapsBackToItsOriginalColumn() {
        RewriteResult result = rewriter.rewrite("let count: long = 0L;", List.of());
        MappingStore store = new MappingStore(result.mappings());

        assertThat(result.source()).isEqualTo("final long count = 0L;");
        // "count" sits at column 12 in the output and column 5 in the input
        assertThat(store.mapToOriginal(1, 12)).isEqualTo(new Position(1, 5));
        assertThat(store.mapToOriginal(1, 7)).isEqualTo(new Position(1, 12));
    }
}
