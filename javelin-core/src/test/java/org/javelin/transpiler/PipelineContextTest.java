package org.javelin.transpiler;

import java.util.ArrayList;
import java.util.List;

import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.javelin.parser.util.AstUtils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineContextTest {

    private static final String SOURCE =
            "import java.util.List;\n" +
            "class A {\n" +
            "    void run(List<String> __tmp0) {\n" +
            "        first();\n" +
            "        second();\n" +
            "    }\n" +
            "}\n";

    @Test
    void freshName_skipsNamesInTheFile() {
        PipelineContext ctx = PipelineContexts.of(SOURCE);

        assertThat(ctx.freshName("__tmp")).isEqualTo("__tmp1");
        assertThat(ctx.freshName("__tmp")).isEqualTo("__tmp2");
        assertThat(ctx.freshName("__m")).isEqualTo("__m3");
    }

    @Test
    void freshName_isReproduciblePerFile() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        PipelineContext a = PipelineContexts.of(SOURCE);
        PipelineContext b = PipelineContexts.of(SOURCE);
        for (int i = 0; i < 3; i++) {
            first.add(a.freshName("__v"));
            second.add(b.freshName("__v"));
        }

        assertThat(first).isEqualTo(second).doesNotHaveDuplicates();
    }

    @Test
    void requireImport_usesSimpleNameUnlessItClashes() {
        PipelineContext ctx = PipelineContexts.of(SOURCE);

        assertThat(ctx.requireImport("java.util.List")).isEqualTo("List");
        assertThat(ctx.requireImport("java.util.function.Function")).isEqualTo("Function");
        assertThat(ctx.requireImport("java.awt.List")).isEqualTo("java.awt.List");
        assertThat(ctx.requireImport("com.acme.A")).isEqualTo("com.acme.A");
        assertThat(ctx.requiredImports()).containsExactly("java.util.function.Function");
    }

    @Test
    void facts_areCreatedOncePerKey() {
        FactKey<Seen> owner = FactKey.of("owner", Seen.class, Seen::new);
        FactKey<Seen> other = FactKey.of("owner", Seen.class, Seen::new);
        PipelineContext ctx = PipelineContexts.of(SOURCE);
        ctx.facts(owner).names.add("seen");

        assertThat(ctx.facts(owner).names).containsExactly("seen");
        assertThat(ctx.facts(other).names).isEmpty();
        assertThat(PipelineContexts.of(SOURCE).facts(owner).names).isEmpty();
    }

    @Test
    void facts_keepTheirDeclaredType() {
        FactKey<Integer> counter = FactKey.of("counter", Integer.class, () -> 41);
        PipelineContext ctx = PipelineContexts.of(SOURCE);

        assertThat(ctx.facts(counter) + 1).isEqualTo(42);
        assertThat(counter.name()).isEqualTo("counter");
    }

    private static final class Seen {
        final List<String> names = new ArrayList<>();
    }

    @Test
    void replace_recordsOneEditPerSourceNode() {
        PipelineContext ctx = PipelineContexts.of(SOURCE);
        MethodCallExpr first = ctx.unit().findFirst(MethodCallExpr.class).orElseThrow();
        MethodCallExpr replacement = (MethodCallExpr) AstUtils.parseExpression("third()");

        ctx.replace(first, replacement);
        // replacing generated code again retargets the same edit
        ctx.replace(replacement, AstUtils.parseExpression("fourth()"));

        assertThat(ctx.edits()).hasSize(1);
        assertThat(ctx.edits().get(0).replacement()).hasToString("fourth()");
    }

    @Test
    void replace_rejectsDetachedGeneratedNodes() {
        PipelineContext ctx = PipelineContexts.of(SOURCE);
        BlockStmt generated = new BlockStmt();
        ExpressionStmt inner = new ExpressionStmt(AstUtils.parseExpression("a()"));
        generated.addStatement(inner);

        assertThatThrownBy(() -> ctx.replace(inner, AstUtils.parseStatement("b();")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void insertBefore_addsToTheBlockAndTheEdit() {
        PipelineContext ctx = PipelineContexts.of(SOURCE);
        ExpressionStmt second = ctx.unit().findAll(ExpressionStmt.class).get(1);
        Statement inserted = AstUtils.parseStatement("between();");

        ctx.insertBefore(second, inserted);

        BlockStmt body = (BlockStmt) second.getParentNode().orElseThrow();
        assertThat(body.getStatements()).extracting(Statement::toString)
                                        .containsExactly("first();", "between();", "second();");
        assertThat(ctx.edits()).singleElement().satisfies(edit -> assertThat(edit.before()).containsExactly(inserted));
    }

    @Test
    void warn_isReportedAgainstTheCurrentPlugin() {
        PipelineContext ctx = PipelineContexts.of(SOURCE);
        ctx.enterPlugin("checker");

        ctx.warn("looks odd", ctx.unit().findFirst(MethodCallExpr.class).orElseThrow());

        assertThat(ctx.diagnostics().diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.severity()).isEqualTo(Diagnostic.Severity.WARNING);
            assertThat(d.plugin()).isEqualTo("checker");
            assertThat(d.position().line()).isEqualTo(4);
        });
    }
}
