package org.javelin.transpiler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.stmt.Statement;
import org.javelin.mapping.MappingStore;
import org.javelin.parser.printer.StructuralPrinter;
import org.javelin.rewrite.SourceScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the final Java text. Untouched code keeps the exact layout of the rewritten
 * source; only the regions recorded as {@link SpliceEdit}s are pretty printed. Every change
 * in line count is reported to the {@link MappingStore} so positions below it stay valid.
 */
public class SplicingPrinter {

    private static final Logger log = LoggerFactory.getLogger(SplicingPrinter.class);

    private final StructuralPrinter printer;

    public SplicingPrinter(StructuralPrinter printer) {
        this.printer = printer;
    }

    public String print(PipelineContext ctx, List<TypeDeclaration<?>> injected) {
        StringBuilder text = new StringBuilder(ctx.source());
        SourceScanner scanner = new SourceScanner(ctx.source());
        MappingStore mappings = ctx.mappings();

        List<SpliceEdit> edits = outermost(ctx.edits());
        edits.sort(Comparator.comparing((SpliceEdit e) -> e.range().begin).reversed());
        for (SpliceEdit edit : edits) {
            Range range = edit.range();
            int start = scanner.lineStart(range.begin.line) + range.begin.column - 1;
            int end = scanner.lineStart(range.end.line) + range.end.column;
            String replacement = render(edit, indentOf(ctx.source(), scanner.lineStart(range.begin.line)));
            text.replace(start, end, replacement);
            int delta = SourceScanner.countNewlines(replacement) - (range.end.line - range.begin.line);
            mappings.shift(range.end.line, delta);
        }

        insertImports(ctx, text, scanner);

        if (!injected.isEmpty()) {
            if (text.length() > 0 && text.charAt(text.length() - 1) != '\n') {
                text.append('\n');
            }
            for (TypeDeclaration<?> declaration : injected) {
                text.append('\n').append(printer.print(declaration).stripTrailing()).append('\n');
            }
        }
        log.debug("{}: spliced {} edits", ctx.fileName(), edits.size());
        return text.toString();
    }

    /**
     * Drops every edit lying inside another one: the outer edit prints the current tree,
     * which already contains the inner change. Of two edits with the same range the later
     * one wins.
     */
    static List<SpliceEdit> outermost(List<SpliceEdit> edits) {
        List<SpliceEdit> kept = new ArrayList<>();
        for (int i = 0; i < edits.size(); i++) {
            SpliceEdit candidate = edits.get(i);
            boolean covered = false;
            for (int j = 0; j < edits.size() && !covered; j++) {
                if (i == j) {
                    continue;
                }
                SpliceEdit other = edits.get(j);
                if (other.range().equals(candidate.range())) {
                    covered = j > i;
                } else {
                    covered = other.contains(candidate);
                }
            }
            if (!covered) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private String render(SpliceEdit edit, String indent) {
        StringBuilder sb = new StringBuilder();
        for (Statement statement : edit.before()) {
            sb.append(printer.print(statement).stripTrailing()).append('\n');
        }
        sb.append(printer.print(edit.replacement()).stripTrailing());
        String[] lines = sb.toString().split("\n", -1);
        StringBuilder out = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            out.append('\n');
            if (!lines[i].isEmpty()) {
                out.append(indent).append(lines[i]);
            }
        }
        return out.toString();
    }

    private static String indentOf(String source, int lineStart) {
        int i = lineStart;
        while (i < source.length() && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
            i++;
        }
        return source.substring(lineStart, i);
    }

    private static void insertImports(PipelineContext ctx, StringBuilder text, SourceScanner scanner) {
        CompilationUnit unit = ctx.unit();
        List<String> missing = new ArrayList<>();
        for (String required : ctx.requiredImports()) {
            boolean present = false;
            for (ImportDeclaration existing : unit.getImports()) {
                if (!existing.isStatic() && !existing.isAsterisk() && existing.getNameAsString().equals(required)) {
                    present = true;
                }
            }
            if (!present) {
                missing.add(required);
            }
        }
        if (missing.isEmpty()) {
            return;
        }

        int afterLine = 0;
        if (unit.getImports().isNonEmpty()) {
            afterLine = unit.getImports().getLast().flatMap(i -> i.getEnd()).map(p -> p.line).orElse(0);
        } else if (unit.getPackageDeclaration().isPresent()) {
            afterLine = unit.getPackageDeclaration().get().getEnd().map(p -> p.line).orElse(0);
        }

        StringBuilder block = new StringBuilder();
        for (String qualifiedName : missing) {
            block.append("import ").append(qualifiedName).append(";\n");
        }
        if (afterLine == 0) {
            text.insert(0, block);
        } else {
            // edits never reach above the imports, so offsets up to here are unchanged
            int at = scanner.lineEnd(afterLine);
            text.insert(at, "\n" + block.substring(0, block.length() - 1));
        }
        ctx.mappings().shift(afterLine, missing.size());
    }
}
