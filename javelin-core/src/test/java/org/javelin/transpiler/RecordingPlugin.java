package org.javelin.transpiler;

import java.util.List;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.TypeDeclaration;

/**
 * Appends {@code phase:name} to a shared log for every call it receives.
 */
class RecordingPlugin implements Plugin {

    private final PluginDescriptor descriptor;
    private final List<String> log;

    RecordingPlugin(String name, List<String> log, List<String> dependencies, Capability first, Capability... rest) {
        this.descriptor = PluginDescriptor.of(name, "records " + name, dependencies, first, rest);
        this.log = log;
    }

    @Override
    public PluginDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public void receiveContext(PipelineContext ctx) {
        log.add("context:" + name());
    }

    @Override
    public void discover(CompilationUnit unit, PipelineContext ctx) {
        log.add("discover:" + name());
    }

    @Override
    public Node transform(Node node, PipelineContext ctx) {
        if (node instanceof CompilationUnit || node.getParentNode().orElse(null) instanceof CompilationUnit) {
            log.add("transform:" + name());
        }
        return node;
    }

    @Override
    public List<TypeDeclaration<?>> declarations(PipelineContext ctx) {
        log.add("declarations:" + name());
        return List.of();
    }
}
