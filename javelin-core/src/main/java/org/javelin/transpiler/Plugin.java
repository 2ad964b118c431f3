package org.javelin.transpiler;

import java.util.List;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.TypeDeclaration;

/**
 * A stage-2 component working on the parsed tree of one file. Which of the methods below
 * are called is decided by {@link PluginDescriptor#capabilities()}, never by overriding.
 * <p>
 * Plugins are shared across files and threads: per-file state belongs in
 * {@link PipelineContext#facts(FactKey)}, and facts must be
 * keyed by source positions rather than by nodes, since Transform replaces nodes.
 */
public interface Plugin {

    PluginDescriptor descriptor();

    default String name() {
        return descriptor().name();
    }

    /**
     * {@link Capability#SHARED_CONTEXT}: called once before Discovery.
     */
    default void receiveContext(PipelineContext ctx) {
    }

    /**
     * {@link Capability#DISCOVER}: read-only inspection of the whole file.
     */
    default void discover(CompilationUnit unit, PipelineContext ctx) {
    }

    /**
     * {@link Capability#TRANSFORM}: called for every node, children first. Returning a
     * different node replaces {@code node} in the tree. A plugin that must restructure an
     * ancestor does so through {@link PipelineContext#replace(Node, Node)} and returns
     * {@code node} itself.
     */
    default Node transform(Node node, PipelineContext ctx) {
        return node;
    }

    /**
     * {@link Capability#DECLARATIONS}: top level types to append to the file.
     */
    default List<TypeDeclaration<?>> declarations(PipelineContext ctx) {
        return List.of();
    }
}
