package org.javelin.transpiler.plugins;

import org.javelin.Javelin;
import org.javelin.TransformException;
import org.javelin.parser.util.AstUtils;
import org.javelin.transpiler.types.TypeOracle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NullCoalescingPluginTest {

    private static final Javelin JAVELIN = Javelin.builder().typeOracle(TypeOracle.unavailable()).build();

    private static String transpile(String source) {
        String generated = JAVELIN.transpile("Names.jvl", source).generatedSource();
        assertThat(AstUtils.parser().parse(generated).isSuccessful()).as(generated).isTrue();
        return generated;
    }

    @Test
    void nameOnTheLeft_isCheckedInPlace() {
        String generated = transpile("class Names {\n" +
                                     "    String display(String name) {\n" +
                                     "        return name ?? \"anonymous\";\n" +
                                     "    }\n" +
                                     "}\n");

        assertThat(generated).contains("return (name != null ? name : \"anonymous\");")
                             .doesNotContain("Optional");
    }

    @Test
    void computedLeft_isEvaluatedOnce() {
        String generated = transpile("class Names {\n" +
                                     "    String lookup(String key) { return null; }\n" +
                                     "    String display(String key) {\n" +
                                     "        return lookup(key) ?? \"none\";\n" +
                                     "    }\n" +
                                     "}\n");

        assertThat(generated).contains("import java.util.Optional;")
                             .contains("return Optional.ofNullable(lookup(key)).orElseGet(() -> \"none\");");
    }

    @Test
    void chain_triesEachOperandInTurn() {
        String generated = transpile("class Names {\n" +
                                     "    String pick(String first, String second) {\n" +
                                     "        return first ?? second ?? \"none\";\n" +
                                     "    }\n" +
                                     "}\n");

        assertThat(generated).contains("return (first != null ? first : (second != null ? second : \"none\"));");
    }

    @Test
    void optionOnTheLeft_unwraps() {
        String generated = transpile("class Config {\n" +
                                     "    String port(Option<String> configured) {\n" +
                                     "        return configured ?? \"8080\";\n" +
                                     "    }\n" +
                                     "}\n");

        assertThat(generated).contains("return (configured.isSome() ? configured.unwrap() : \"8080\");")
                             .contains("sealed interface Option<T>");
    }

    @Test
    void computedOption_goesThroughATemporary() {
        String generated = transpile("class Config {\n" +
                                     "    Option<String> find(String key) { return None(); }\n" +
                                     "    String value(String key) {\n" +
                                     "        return find(key) ?? \"none\";\n" +
                                     "    }\n" +
                                     "}\n");

        assertThat(generated).contains("import java.util.function.Function;")
                             .contains("((Function<Option<String>, String>) __tmp0 -> __tmp0.isSome() ? __tmp0.unwrap() : \"none\").apply(find(key))");
    }

    @Test
    void primitiveLeft_isRejected() {
        String source = "class Numbers {\n" +
                        "    int pick(int a) {\n" +
                        "        return a ?? 0;\n" +
                        "    }\n" +
                        "}\n";

        assertThatThrownBy(() -> JAVELIN.transpile("Numbers.jvl", source))
            .isInstanceOf(TransformException.class)
            .hasMessageContaining("[null-coalescing] left operand of '??' has primitive type int and is never null");
    }
}
