package org.javelin.transpiler;

import java.util.ArrayList;
import java.util.List;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.javelin.InjectException;
import org.javelin.LimitExceededException;
import org.javelin.TransformPhaseException;
import org.javelin.mapping.Mapping;
import org.javelin.mapping.MappingTag;
import org.javelin.mapping.Position;
import org.javelin.rewrite.SourceScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the ordered plugins over one file in three phases: Discovery, Transform and
 * Inject. The phase lists are built once from the plugin descriptors.
 */
public class TreePipeline {

    private static final Logger log = LoggerFactory.getLogger(TreePipeline.class);

    private final List<Plugin> shared = new ArrayList<>();
    private final List<Plugin> discover = new ArrayList<>();
    private final List<Plugin> transform = new ArrayList<>();
    private final List<Plugin> declarations = new ArrayList<>();

    public TreePipeline(List<Plugin> ordered) {
        for (Plugin plugin : ordered) {
            PluginDescriptor descriptor = plugin.descriptor();
            if (descriptor.has(Capability.SHARED_CONTEXT)) {
                shared.add(plugin);
            }
            if (descriptor.has(Capability.DISCOVER)) {
                discover.add(plugin);
            }
            if (descriptor.has(Capability.TRANSFORM)) {
                transform.add(plugin);
            }
            if (descriptor.has(Capability.DECLARATIONS)) {
                declarations.add(plugin);
            }
        }
    }

    /**
     * Runs every phase and returns the declarations to append to the file. Any failure
     * aborts the whole file: nothing collected so far is returned.
     *
     * @throws TransformPhaseException naming the failing plugin
     */
    public List<TypeDeclaration<?>> run(PipelineContext ctx) {
        CompilationUnit unit = ctx.unit();
        anchorUnmappedLines(ctx);

        for (Plugin plugin : shared) {
            ctx.enterPlugin(plugin.name());
            plugin.receiveContext(ctx);
        }

        for (Plugin plugin : discover) {
            ctx.enterPlugin(plugin.name());
            log.debug("{}: discovery by {}", ctx.fileName(), plugin.name());
            try {
                plugin.discover(unit, ctx);
            } catch (TransformPhaseException | LimitExceededException e) {
                throw e;
            } catch (RuntimeException e) {
                throw ctx.discoveryError(String.valueOf(e.getMessage()), unit, e);
            }
        }

        for (Plugin plugin : transform) {
            ctx.enterPlugin(plugin.name());
            log.debug("{}: transform by {}", ctx.fileName(), plugin.name());
            // snapshot: nodes created by this plugin are not visited again
            List<Node> nodes = unit.stream(Node.TreeTraversal.POSTORDER).toList();
            for (Node node : nodes) {
                if (node == unit || node.findRootNode() != unit) {
                    continue;
                }
                Node result;
                try {
                    result = plugin.transform(node, ctx);
                    if (result != null && result != node) {
                        ctx.replace(node, result);
                    }
                } catch (TransformPhaseException | LimitExceededException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw ctx.transformError(String.valueOf(e.getMessage()), node, e);
                }
            }
        }

        List<TypeDeclaration<?>> injected = new ArrayList<>();
        for (Plugin plugin : declarations) {
            ctx.enterPlugin(plugin.name());
            try {
                injected.addAll(plugin.declarations(ctx));
            } catch (TransformPhaseException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new InjectException(plugin.name(), "<unknown>", e);
            }
        }
        log.debug("{}: {} edits, {} injected declarations", ctx.fileName(), ctx.edits().size(), injected.size());
        return injected;
    }

    /**
     * Gives every statement or member declaration line that the rewrite stage left alone
     * an identity mapping, so that it stays addressable once splices move lines around.
     */
    private static void anchorUnmappedLines(PipelineContext ctx) {
        SourceScanner scanner = new SourceScanner(ctx.source());
        List<Mapping> anchors = new ArrayList<>();
        for (Node node : ctx.unit().findAll(Node.class, n -> n instanceof Statement || n instanceof BodyDeclaration)) {
            if (node instanceof BlockStmt || node.getBegin().isEmpty()) {
                continue;
            }
            int line = node.getBegin().get().line;
            int column = node.getBegin().get().column;
            if (ctx.mappings().hasMappingOnLine(line) || hasAnchor(anchors, line)) {
                continue;
            }
            int length = lineLength(scanner, line) - column + 1;
            Position position = new Position(line, column);
            MappingTag tag = node instanceof Statement ? MappingTag.STATEMENT : MappingTag.DECLARATION;
            anchors.add(Mapping.span(position, position, Math.max(length, 1), tag));
        }
        ctx.mappings().recordAll(anchors);
    }

    private static boolean hasAnchor(List<Mapping> anchors, int line) {
        for (Mapping anchor : anchors) {
            if (anchor.getGeneratedLine() == line) {
                return true;
            }
        }
        return false;
    }

    private static int lineLength(SourceScanner scanner, int line) {
        return scanner.lineEnd(line) - scanner.lineStart(line);
    }
}
