package org.javelin.transpiler;

import java.util.ArrayList;
import java.util.List;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import org.javelin.DiscoveryException;
import org.javelin.InjectException;
import org.javelin.LimitExceededException;
import org.javelin.TransformException;
import org.javelin.mapping.Position;
import org.javelin.parser.util.AstUtils;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreePipelineTest {

    private static final String SOURCE =
            "class A {\n" +
            "    int run() {\n" +
            "        return 1;\n" +
            "    }\n" +
            "}\n";

    private final List<String> log = new ArrayList<>();

    @Test
    void phases_runInDependencyOrder() {
        PluginRegistry registry = new PluginRegistry()
                .register(new RecordingPlugin("b", log, List.of("a"), Capability.DISCOVER, Capability.TRANSFORM))
                .register(new RecordingPlugin("a", log, List.of(), Capability.SHARED_CONTEXT, Capability.DISCOVER,
                                              Capability.TRANSFORM, Capability.DECLARATIONS));

        new TreePipeline(registry.resolveOrder()).run(PipelineContexts.of(SOURCE));

        assertThat(log).containsExactly("context:a", "discover:a", "discover:b", "transform:a", "transform:b", "declarations:a");
    }

    @Test
    void undeclaredCapability_isNeverCalled() {
        RecordingPlugin discoverOnly = new RecordingPlugin("d", log, List.of(), Capability.DISCOVER);

        new TreePipeline(List.of(discoverOnly)).run(PipelineContexts.of(SOURCE));

        assertThat(log).containsExactly("discover:d");
    }

    @Test
    void returnedNode_replacesTheVisitedOne() {
        Plugin bump = new Plugin() {
            @Override
            public PluginDescriptor descriptor() {
                return PluginDescriptor.of("bump", "literal 1 becomes 2", List.of(), Capability.TRANSFORM);
            }

            @Override
            public Node transform(Node node, PipelineContext ctx) {
                if (node instanceof IntegerLiteralExpr && ((IntegerLiteralExpr) node).getValue().equals("1")) {
                    return new IntegerLiteralExpr("2");
                }
                return node;
            }
        };
        PipelineContext ctx = PipelineContexts.of(SOURCE);

        new TreePipeline(List.of(bump)).run(ctx);

        assertThat(ctx.unit().findFirst(IntegerLiteralExpr.class).orElseThrow().getValue()).isEqualTo("2");
        assertThat(ctx.edits()).hasSize(1);
    }

    @Test
    void discoveryFailure_namesThePlugin() {
        Plugin broken = failing("broken", Capability.DISCOVER, new IllegalStateException("boom"));

        assertThatThrownBy(() -> new TreePipeline(List.of(broken)).run(PipelineContexts.of(SOURCE)))
            .isInstanceOf(DiscoveryException.class)
            .hasMessageStartingWith("[broken] boom")
            .hasCauseInstanceOf(IllegalStateException.class)
            .satisfies(e -> assertThat(((DiscoveryException) e).getPluginName()).isEqualTo("broken"));
    }

    @Test
    void transformFailure_carriesThePosition() {
        Plugin broken = failing("broken", Capability.TRANSFORM, new IllegalStateException("boom"));

        assertThatThrownBy(() -> new TreePipeline(List.of(broken)).run(PipelineContexts.of(SOURCE)))
            .isInstanceOf(TransformException.class)
            .satisfies(e -> assertThat(((TransformException) e).getPosition()).isNotEqualTo(Position.UNKNOWN));
    }

    @Test
    void injectFailure_isAnInjectException() {
        Plugin broken = failing("broken", Capability.DECLARATIONS, new IllegalStateException("boom"));

        assertThatThrownBy(() -> new TreePipeline(List.of(broken)).run(PipelineContexts.of(SOURCE)))
            .isInstanceOf(InjectException.class)
            .hasMessageContaining("[broken] failed to inject declaration");
    }

    @Test
    void limitFailure_propagatesUnwrapped() {
        Plugin broken = failing("broken", Capability.DISCOVER, new LimitExceededException("maxCombinations", 2, 1, "too many"));

        assertThatThrownBy(() -> new TreePipeline(List.of(broken)).run(PipelineContexts.of(SOURCE)))
            .isExactlyInstanceOf(LimitExceededException.class);
    }

    @Test
    void injectedDeclarations_areCollectedInPluginOrder() {
        Plugin first = declaring("first", "interface First {}");
        Plugin second = declaring("second", "interface Second {}");

        List<TypeDeclaration<?>> injected = new TreePipeline(List.of(first, second)).run(PipelineContexts.of(SOURCE));

        assertThat(injected).extracting(TypeDeclaration::getNameAsString).containsExactly("First", "Second");
    }

    @Test
    void untouchedLines_getIdentityAnchors() {
        PipelineContext ctx = PipelineContexts.of(SOURCE);

        new TreePipeline(List.of()).run(ctx);

        assertThat(ctx.mappings().hasMappingOnLine(3)).isTrue();
        ctx.mappings().shift(2, 4);
        assertThat(ctx.mappings().mapToOriginal(7, 9)).isEqualTo(new Position(3, 9));
    }

    private static Plugin failing(String name, Capability capability, RuntimeException failure) {
        return new Plugin() {
            @Override
            public PluginDescriptor descriptor() {
                return PluginDescriptor.of(name, "always fails", List.of(), capability);
            }

            @Override
            public void discover(CompilationUnit unit, PipelineContext ctx) {
                throw failure;
            }

            @Override
            public Node transform(Node node, PipelineContext ctx) {
                throw failure;
            }

            @Override
            public List<TypeDeclaration<?>> declarations(PipelineContext ctx) {
                throw failure;
            }
        };
    }

    private static Plugin declaring(String name, String declaration) {
        return new Plugin() {
            @Override
            public PluginDescriptor descriptor() {
                return PluginDescriptor.of(name, "declares a type", List.of(), Capability.DECLARATIONS);
            }

            @Override
            public List<TypeDeclaration<?>> declarations(PipelineContext ctx) {
                return List.of(AstUtils.parseTypeDeclaration(declaration));
            }
        };
    }
}
