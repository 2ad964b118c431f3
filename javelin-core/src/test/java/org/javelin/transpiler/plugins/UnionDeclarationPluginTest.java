package org.javelin.transpiler.plugins;

import org.javelin.DiscoveryException;
import org.javelin.Javelin;
import org.javelin.parser.util.AstUtils;
import org.javelin.transpiler.TranspiledResult;
import org.javelin.transpiler.types.TypeOracle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnionDeclarationPluginTest {

    private static final Javelin JAVELIN = Javelin.builder().typeOracle(TypeOracle.unavailable()).build();

    private static TranspiledResult transpile(String source) {
        return JAVELIN.transpile("Shapes.jvl", source);
    }

    @Test
    void union_becomesSealedInterfaceWithRecords() {
        String source = "union Shape {\n" +
                        "    Circle(double radius),\n" +
                        "    Empty\n" +
                        "}\n" +
                        "class Area {\n" +
                        "    double of(Shape shape) { return 0; }\n" +
                        "}\n";

        String generated = transpile(source).generatedSource();

        assertThat(generated).contains("sealed interface Shape")
                             .contains("record Circle(double radius) implements Shape")
                             .contains("record Empty() implements Shape")
                             .contains("double of(Shape shape) { return 0; }")
                             .doesNotContain("JavelinUnion");
        assertThat(AstUtils.parser().parse(generated).isSuccessful()).isTrue();
    }

    @Test
    void genericUnion_passesTypeParametersToEveryRecord() {
        String generated = transpile("public union Pair<A, B> { Both(A first, B second), Neither }\n").generatedSource();

        assertThat(generated).contains("public sealed interface Pair<A, B>")
                             .contains("record Both<A, B>(A first, B second) implements Pair<A, B>")
                             .contains("record Neither<A, B>() implements Pair<A, B>");
    }

    @Test
    void duplicateVariant_isRejected() {
        String source = "union Shape {\n" +
                        "    Circle(double radius),\n" +
                        "    Circle(double diameter)\n" +
                        "}\n";

        assertThatThrownBy(() -> transpile(source))
            .isInstanceOf(DiscoveryException.class)
            .satisfies(e -> {
                DiscoveryException discovery = (DiscoveryException) e;
                assertThat(discovery.getPluginName()).isEqualTo(UnionDeclarationPlugin.NAME);
                assertThat(discovery.getMessage()).contains("variant 'Circle' is declared twice in union 'Shape'");
                assertThat(discovery.getPosition().line()).isEqualTo(3);
            });
    }

    @Test
    void lowerCaseVariant_isRejected() {
        assertThatThrownBy(() -> transpile("union Shape { circle(double radius) }\n"))
            .isInstanceOf(DiscoveryException.class)
            .hasMessageContaining("variant 'circle' of union 'Shape' must start with an upper case letter");
    }

    @Test
    void unionDeclaredTwice_isRejected() {
        String source = "union Shape { Circle(double radius) }\n" +
                        "union Shape { Square(double side) }\n";

        assertThatThrownBy(() -> transpile(source))
            .isInstanceOf(DiscoveryException.class)
            .hasMessageContaining("union 'Shape' is declared more than once");
    }
}
