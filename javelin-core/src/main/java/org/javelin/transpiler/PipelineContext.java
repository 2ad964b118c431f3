package org.javelin.transpiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import org.javelin.DiscoveryException;
import org.javelin.JavelinConfig;
import org.javelin.TransformException;
import org.javelin.mapping.MappingStore;
import org.javelin.mapping.Position;
import org.javelin.transpiler.types.TypeFactCache;

/**
 * State of one file's trip through the tree pipeline. Created per file and discarded
 * afterwards, so it is never shared between threads.
 * <p>
 * Every structural change a plugin makes goes through {@link #replace(Node, Node)} or
 * {@link #insertBefore(Statement, Statement)}: the tree is updated and the change is
 * recorded as a {@link SpliceEdit} against the rewritten source, which is what
 * {@link SplicingPrinter} later prints.
 */
public class PipelineContext {

    private final String fileName;
    private final String source;
    private final CompilationUnit unit;
    private final MappingStore mappings;
    private final TypeFactCache types;
    private final JavelinConfig config;
    private final DiagnosticSink diagnostics;

    private final Set<String> takenNames = new HashSet<>();
    private int nameCounter;
    private final Map<FactKey<?>, Object> facts = new HashMap<>();
    private final List<SpliceEdit> edits = new ArrayList<>();
    private final Set<String> requiredImports = new LinkedHashSet<>();
    private String currentPlugin = "pipeline";

    public PipelineContext(String fileName, String source, CompilationUnit unit, MappingStore mappings,
                           TypeFactCache types, JavelinConfig config) {
        this.fileName = fileName;
        this.source = source;
        this.unit = unit;
        this.mappings = mappings;
        this.types = types;
        this.config = config;
        this.diagnostics = new DiagnosticSink(fileName);
        for (SimpleName name : unit.findAll(SimpleName.class)) {
            takenNames.add(name.getIdentifier());
        }
    }

    public String fileName() {
        return fileName;
    }

    /**
     * The source after the text rewrite stage, which is what {@link #unit()} was parsed from.
     */
    public String source() {
        return source;
    }

    public CompilationUnit unit() {
        return unit;
    }

    public MappingStore mappings() {
        return mappings;
    }

    public TypeFactCache types() {
        return types;
    }

    public JavelinConfig config() {
        return config;
    }

    public DiagnosticSink diagnostics() {
        return diagnostics;
    }

    public String currentPlugin() {
        return currentPlugin;
    }

    void enterPlugin(String pluginName) {
        this.currentPlugin = pluginName;
    }

    public Optional<Node> parentOf(Node node) {
        return node.getParentNode();
    }

    /**
     * A name not used anywhere in the file nor handed out before. One counter serves every
     * prefix, so the result depends only on the file and the order of requests.
     */
    public String freshName(String prefix) {
        String name;
        do {
            name = prefix + nameCounter++;
        } while (takenNames.contains(name));
        takenNames.add(name);
        return name;
    }

    /**
     * Per-file state behind {@code key}, created on first use.
     */
    public <T> T facts(FactKey<T> key) {
        return key.cast(facts.computeIfAbsent(key, k -> key.create()));
    }

    /**
     * Asks for {@code qualifiedName} to be imported and returns the name to write in code:
     * the simple name, or the qualified one when the simple name already means something
     * else in this file.
     */
    public String requireImport(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        String simple = qualifiedName.substring(dot + 1);
        for (ImportDeclaration existing : unit.getImports()) {
            if (existing.isStatic() || existing.isAsterisk()) {
                continue;
            }
            if (existing.getNameAsString().equals(qualifiedName)) {
                return simple;
            }
            if (existing.getName().getIdentifier().equals(simple)) {
                return qualifiedName;
            }
        }
        for (TypeDeclaration<?> type : unit.findAll(TypeDeclaration.class)) {
            if (type.getNameAsString().equals(simple)) {
                return qualifiedName;
            }
        }
        for (String required : requiredImports) {
            if (!required.equals(qualifiedName) && required.endsWith("." + simple)) {
                return qualifiedName;
            }
        }
        requiredImports.add(qualifiedName);
        return simple;
    }

    public Set<String> requiredImports() {
        return Collections.unmodifiableSet(requiredImports);
    }

    /**
     * Where {@code node} started in the original source, or {@link Position#UNKNOWN} for
     * generated nodes.
     */
    public Position originalPosition(Node node) {
        return node.getBegin()
                   .map(begin -> mappings.mapToOriginal(begin.line, begin.column))
                   .orElse(Position.UNKNOWN);
    }

    public DiscoveryException discoveryError(String message, Node node, Throwable cause) {
        return new DiscoveryException(message, currentPlugin, originalPosition(node), cause);
    }

    public TransformException transformError(String message, Node node, Throwable cause) {
        return new TransformException(message, currentPlugin, originalPosition(node), cause);
    }

    public void warn(String message, Node node) {
        diagnostics.warn(currentPlugin, message, originalPosition(node));
    }

    /**
     * Replaces {@code original} by {@code replacement} in the tree and records the edit.
     *
     * @throws IllegalStateException if the node cannot be replaced in its parent, or if it
     *                               has no source range and is not inside a recorded edit
     */
    public void replace(Node original, Node replacement) {
        SpliceEdit owner = editReplacing(original);
        Optional<Range> range = original.getRange();
        if (!original.replace(replacement)) {
            throw new IllegalStateException("cannot replace " + original.getClass().getSimpleName() + " in its parent");
        }
        if (owner != null) {
            owner.retarget(replacement);
        } else if (range.isPresent()) {
            edits.add(new SpliceEdit(range.get(), replacement));
        } else if (!isInsideEdit(replacement)) {
            throw new IllegalStateException("generated " + original.getClass().getSimpleName() + " is not part of any edit");
        }
    }

    /**
     * Inserts {@code inserted} right before {@code anchor} in the enclosing block.
     */
    public void insertBefore(Statement anchor, Statement inserted) {
        Node parent = anchor.getParentNode()
                            .orElseThrow(() -> new IllegalStateException("statement has no parent"));
        NodeList<Statement> statements;
        if (parent instanceof BlockStmt) {
            statements = ((BlockStmt) parent).getStatements();
        } else if (parent instanceof SwitchEntry) {
            statements = ((SwitchEntry) parent).getStatements();
        } else {
            throw new IllegalStateException("cannot insert a statement into " + parent.getClass().getSimpleName());
        }
        int index = -1;
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == anchor) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            throw new IllegalStateException("statement is not part of its parent's statements");
        }
        SpliceEdit owner = editReplacing(anchor);
        statements.add(index, inserted);
        if (owner != null) {
            owner.before().add(inserted);
        } else if (anchor.getRange().isPresent()) {
            SpliceEdit edit = new SpliceEdit(anchor.getRange().get(), anchor);
            edit.before().add(inserted);
            edits.add(edit);
        } else if (!isInsideEdit(inserted)) {
            throw new IllegalStateException("generated statement is not part of any edit");
        }
    }

    List<SpliceEdit> edits() {
        return Collections.unmodifiableList(edits);
    }

    private SpliceEdit editReplacing(Node node) {
        for (SpliceEdit edit : edits) {
            if (edit.replacement() == node) {
                return edit;
            }
        }
        return null;
    }

    private boolean isInsideEdit(Node node) {
        Node current = node.getParentNode().orElse(null);
        while (current != null) {
            if (editReplacing(current) != null) {
                return true;
            }
            Optional<Range> range = current.getRange();
            if (range.isPresent()) {
                for (SpliceEdit edit : edits) {
                    if (edit.range().contains(range.get())) {
                        return true;
                    }
                }
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }
}
