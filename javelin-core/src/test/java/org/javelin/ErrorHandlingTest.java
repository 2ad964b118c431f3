package org.javelin;

import java.util.List;

import com.github.javaparser.ast.body.TypeDeclaration;
import org.javelin.mapping.Position;
import org.javelin.transpiler.Capability;
import org.javelin.transpiler.PipelineContext;
import org.javelin.transpiler.Plugin;
import org.javelin.transpiler.PluginDescriptor;
import org.javelin.transpiler.types.TypeOracle;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ErrorHandlingTest {

    private final Javelin javelin = Javelin.builder().typeOracle(TypeOracle.unavailable()).build();

    // 1. SyntaxRewriteException: malformed Javelin construct, original coordinates
    @Test
    void syntaxError_carriesRewriterAndPosition() {
        String source = "class A {\n" +
                        "    union Empty { }\n" +
                        "}\n";

        assertThatThrownBy(() -> javelin.transpile("A.jvl", source))
            .isInstanceOf(SyntaxRewriteException.class)
            .satisfies(e -> {
                SyntaxRewriteException se = (SyntaxRewriteException) e;
                assertThat(se.getRewriter()).isEqualTo("union");
                assertThat(se.getLine()).isEqualTo(2);
                assertThat(se.getMessage()).startsWith("union: union declares no variants at 2:");
                assertThat(se).isInstanceOf(JavelinException.class);
            });
    }

    // 2. SourceParseException: rewritten text is not Java
    @Test
    void parseError_mapsBackToTheOriginalLine() {
        String source = "class A {\n" +
                        "    void run() {\n" +
                        "        int x = ;\n" +
                        "    }\n" +
                        "}\n";

        assertThatThrownBy(() -> javelin.transpile("A.jvl", source))
            .isInstanceOf(SourceParseException.class)
            .satisfies(e -> {
                SourceParseException pe = (SourceParseException) e;
                assertThat(pe.getPosition().line()).isEqualTo(3);
                assertThat(pe.getProblems()).isNotBlank();
                assertThat(pe.getMessage()).startsWith("rewritten source is not valid Java at 3:");
            });
    }

    // 3. DiscoveryException with ExhaustivenessException cause
    @Test
    void nonExhaustiveMatch_isADiscoveryFailure() {
        String source = "union Light { Red, Amber, Green }\n" +
                        "class Lights {\n" +
                        "    boolean stop(Light light) {\n" +
                        "        return match (light) { Red => true, Amber => true };\n" +
                        "    }\n" +
                        "}\n";

        assertThatThrownBy(() -> javelin.transpile("Lights.jvl", source))
            .isInstanceOf(DiscoveryException.class)
            .satisfies(e -> {
                DiscoveryException de = (DiscoveryException) e;
                assertThat(de.getPluginName()).isEqualTo("pattern-match");
                assertThat(de.getPosition()).isEqualTo(new Position(4, 16));
                assertThat(de.getMessage()).isEqualTo("[pattern-match] non-exhaustive match, missing Green at 4:16");
                ExhaustivenessException ee = (ExhaustivenessException) de.getCause();
                assertThat(ee.getMissing()).containsExactly("Green");
                assertThat(ee.getPosition()).isEqualTo(new Position(4, 16));
                assertThat(de).isInstanceOf(TransformPhaseException.class);
            });
    }

    // 4. TransformException: a plugin rejects a node while rewriting
    @Test
    void transformError_namesThePlugin() {
        String source = "union Light { Red, Amber, Green }\n" +
                        "class Lights {\n" +
                        "    Light next() { return Red(1); }\n" +
                        "}\n";

        assertThatThrownBy(() -> javelin.transpile("Lights.jvl", source))
            .isInstanceOf(TransformException.class)
            .satisfies(e -> {
                TransformException te = (TransformException) e;
                assertThat(te.getPluginName()).isEqualTo("variant-constructors");
                assertThat(te.getPosition().line()).isEqualTo(3);
                assertThat(te.getMessage()).contains("variant Light.Red takes 0 argument(s) but 1 were given");
            });
    }

    // 5. LimitExceededException: tuple too wide, not wrapped by the pipeline
    @Test
    void tupleArityLimit_isReportedDirectly() {
        Javelin narrow = new Javelin(JavelinConfig.builder().maxTupleArity(2).typeCheckEnabled(false).build());
        String source = "class Wide {\n" +
                        "    int pick(int a, int b, int c) {\n" +
                        "        return match (a, b, c) { _ => 0 };\n" +
                        "    }\n" +
                        "}\n";

        assertThatThrownBy(() -> narrow.transpile("Wide.jvl", source))
            .isInstanceOf(LimitExceededException.class)
            .satisfies(e -> {
                LimitExceededException le = (LimitExceededException) e;
                assertThat(le.getLimit()).isEqualTo("maxTupleArity");
                assertThat(le.getActual()).isEqualTo(3);
                assertThat(le.getMaximum()).isEqualTo(2);
            });
    }

    // 6. LimitExceededException: too many combinations to enumerate
    @Test
    void combinationLimit_asksForWildcard() {
        Javelin small = new Javelin(JavelinConfig.builder().maxCombinations(2).typeCheckEnabled(false).build());
        String source = "union Light { Red, Amber, Green }\n" +
                        "class Lights {\n" +
                        "    int pair(Light a, Light b) {\n" +
                        "        return match (a, b) { (Red, Red) => 1, (Red, Amber) => 2, (Amber, Green) => 3 };\n" +
                        "    }\n" +
                        "}\n";

        assertThatThrownBy(() -> small.transpile("Lights.jvl", source))
            .isInstanceOf(LimitExceededException.class)
            .hasMessageContaining("too many required combinations — add a wildcard row")
            .satisfies(e -> assertThat(((LimitExceededException) e).getLimit()).isEqualTo("maxCombinations"));
    }

    // 7. TypeUnavailableException: a match initializer whose type cannot be inferred
    @Test
    void untypedInitializer_isReportedWithPurpose() {
        String source = "union Light { Red, Amber, Green }\n" +
                        "class Lights {\n" +
                        "    void show(Light light) {\n" +
                        "        let label = match (light) { Red => lookup(), _ => lookup() };\n" +
                        "    }\n" +
                        "}\n";

        assertThatThrownBy(() -> javelin.transpile("Lights.jvl", source))
            .isInstanceOf(TransformException.class)
            .hasRootCauseInstanceOf(TypeUnavailableException.class)
            .satisfies(e -> {
                TypeUnavailableException te = (TypeUnavailableException) e.getCause();
                assertThat(te.getExpression()).isEqualTo("label");
                assertThat(te.getPurpose()).isEqualTo("declaring the variable a match initializes");
                assertThat(te.getMessage()).isEqualTo("type required but unavailable for 'label' (declaring the variable a match initializes)");
            });
    }

    // 8. InjectException: declarations that cannot be built
    @Test
    void brokenDeclaration_isAnInjectFailure() {
        Plugin broken = new Plugin() {
            @Override
            public PluginDescriptor descriptor() {
                return PluginDescriptor.of("broken", "emits an invalid declaration", List.of(), Capability.DECLARATIONS);
            }

            @Override
            public List<TypeDeclaration<?>> declarations(PipelineContext ctx) {
                throw new IllegalStateException("cannot build");
            }
        };
        Javelin withBroken = Javelin.builder().typeOracle(TypeOracle.unavailable()).plugin(broken).build();

        assertThatThrownBy(() -> withBroken.transpile("A.jvl", "class A { }\n"))
            .isInstanceOf(InjectException.class)
            .satisfies(e -> {
                InjectException ie = (InjectException) e;
                assertThat(ie.getPluginName()).isEqualTo("broken");
                assertThat(ie.getDeclarationName()).isEqualTo("<unknown>");
                assertThat(ie.getMessage()).isEqualTo("[broken] failed to inject declaration '<unknown>'");
                assertThat(ie.getCause()).hasMessage("cannot build");
            });
    }

    // 9. PluginDependencyException: unknown dependency, raised when the pipeline is built
    @Test
    void unknownDependency_failsAtConstruction() {
        Plugin orphan = new Plugin() {
            @Override
            public PluginDescriptor descriptor() {
                return PluginDescriptor.of("orphan", "needs a missing plugin", List.of("missing"), Capability.DISCOVER);
            }
        };

        assertThatThrownBy(() -> Javelin.builder().plugin(orphan).build())
            .isInstanceOf(PluginDependencyException.class)
            .satisfies(e -> {
                PluginDependencyException pe = (PluginDependencyException) e;
                assertThat(pe.getPlugins()).containsExactly("orphan", "missing");
                assertThat(pe.getMessage()).isEqualTo("plugin 'orphan' depends on unknown plugin 'missing': orphan, missing");
            });
    }

    // 10. Every failure shares one base type
    @Test
    void allFailures_areJavelinExceptions() {
        assertThat(new SyntaxRewriteException("keywords", "x", 1, 1)).isInstanceOf(JavelinException.class);
        assertThat(new SourceParseException("x", Position.UNKNOWN, "p")).isInstanceOf(JavelinException.class);
        assertThat(new LimitExceededException("maxCombinations", 2, 1, "x")).isInstanceOf(JavelinException.class);
        assertThat(new TypeUnavailableException("e", "p")).isInstanceOf(JavelinException.class);
        assertThat(new ExhaustivenessException(List.of("A"), Position.UNKNOWN)).isInstanceOf(JavelinException.class)
                                                                              .hasMessage("non-exhaustive match, missing A");
        assertThat(new PluginDependencyException("x", List.of("a"))).isInstanceOf(JavelinException.class);
        assertThat(new InjectException("p", "D", null)).isInstanceOf(TransformPhaseException.class);
    }
}
