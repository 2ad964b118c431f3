package org.javelin.rewrite;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.javelin.mapping.Mapping;
import org.javelin.mapping.MappingStore;
import org.javelin.mapping.MappingTag;
import org.javelin.mapping.Position;

/**
 * Collects non-overlapping replacements against one source text and applies them at once.
 * <p>
 * A replacement must contain as many line breaks as the text it replaces, so every rewrite
 * keeps the line structure of the file. Mappings handed in are carried over to the new
 * column of the text they point at; a mapping that pointed into the middle of a replaced
 * region is dropped, since the rewriter anchors that region itself.
 */
final class SourceEditor {

    private final String rewriterName;
    private final SourceScanner scanner;
    private final List<Mapping> incoming;
    private final MappingStore incomingStore;
    private final List<Edit> edits = new ArrayList<>();
    private final List<SourceAnchor> sourceAnchors = new ArrayList<>();

    SourceEditor(String rewriterName, SourceScanner scanner, List<Mapping> incoming) {
        this.rewriterName = rewriterName;
        this.scanner = scanner;
        this.incoming = incoming;
        this.incomingStore = new MappingStore(incoming);
    }

    SourceScanner scanner() {
        return scanner;
    }

    boolean hasEdits() {
        return !edits.isEmpty();
    }

    Edit replace(int start, int end, String replacement) {
        String replaced = scanner.source().substring(start, end);
        if (SourceScanner.countNewlines(replaced) != SourceScanner.countNewlines(replacement)) {
            throw new IllegalStateException(rewriterName + " must keep line structure when replacing '" + replaced + "'");
        }
        Edit edit = new Edit(start, end, replacement, edits.size());
        edits.add(edit);
        return edit;
    }

    Edit insert(int at, String text) {
        return replace(at, at, text);
    }

    /**
     * Records a mapping for text that is kept as is but may move on its line.
     */
    void anchorSource(int sourceIndex, int length, MappingTag tag) {
        sourceAnchors.add(new SourceAnchor(sourceIndex, length, tag));
    }

    /**
     * Position in the original file of an offset in the text being edited.
     */
    Position originalOf(int sourceIndex) {
        return incomingStore.mapToOriginal(scanner.lineOf(sourceIndex), scanner.columnOf(sourceIndex));
    }

    RewriteResult finish() {
        if (edits.isEmpty()) {
            return RewriteResult.unchanged(scanner.source(), incoming);
        }
        List<Edit> ordered = new ArrayList<>(edits);
        ordered.sort(Comparator.comparingInt((Edit e) -> e.start).thenComparingInt(e -> e.order));
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).start < ordered.get(i - 1).end) {
                throw new IllegalStateException(rewriterName + " produced overlapping edits at offset " + ordered.get(i).start);
            }
        }

        StringBuilder out = new StringBuilder(scanner.length() + 64);
        int cursor = 0;
        for (Edit edit : ordered) {
            out.append(scanner.source(), cursor, edit.start);
            edit.newStart = out.length();
            out.append(edit.replacement);
            cursor = edit.end;
        }
        out.append(scanner.source(), cursor, scanner.length());
        String rewritten = out.toString();
        SourceScanner result = new SourceScanner(rewritten);

        List<Mapping> mappings = new ArrayList<>(incoming.size() + edits.size() * 2);
        for (Mapping m : incoming) {
            Mapping moved = move(m, ordered, result);
            if (moved != null) {
                mappings.add(moved);
            }
        }
        for (SourceAnchor anchor : sourceAnchors) {
            int newIndex = newIndexOf(anchor.sourceIndex, ordered);
            mappings.add(Mapping.span(originalOf(anchor.sourceIndex),
                                      new Position(result.lineOf(newIndex), result.columnOf(newIndex)),
                                      anchor.length, anchor.tag));
        }
        for (Edit edit : edits) {
            for (EditAnchor anchor : edit.anchors) {
                int newIndex = edit.newStart + anchor.offset;
                Position generated = new Position(result.lineOf(newIndex), result.columnOf(newIndex));
                Position original = originalOf(anchor.sourceIndex);
                mappings.add(anchor.tag == MappingTag.MARKER ?
                        Mapping.marker(original, generated) :
                        Mapping.span(original, generated, anchor.length, anchor.tag));
            }
        }
        return new RewriteResult(rewritten, mappings);
    }

    private Mapping move(Mapping m, List<Edit> ordered, SourceScanner result) {
        if (m.getGeneratedLine() < 1 || m.getGeneratedLine() > scanner.lineCount()) {
            return m;
        }
        int lineStart = scanner.lineStart(m.getGeneratedLine());
        int lineEnd = scanner.lineEnd(m.getGeneratedLine());
        int index = lineStart + m.getGeneratedColumn() - 1;
        int overflow = 0;
        if (index > lineEnd) {
            overflow = index - lineEnd;
            index = lineEnd;
        }
        for (Edit edit : ordered) {
            if (edit.start < index && index < edit.end) {
                return null;
            }
        }
        int newIndex = newIndexOf(index, ordered);
        int column = result.columnOf(newIndex) + overflow;
        if (column == m.getGeneratedColumn() && result.lineOf(newIndex) == m.getGeneratedLine()) {
            return m;
        }
        return new Mapping(m.getOriginalLine(), m.getOriginalColumn(), result.lineOf(newIndex), column, m.getLength(), m.getTag());
    }

    private static int newIndexOf(int oldIndex, List<Edit> ordered) {
        int delta = 0;
        for (Edit edit : ordered) {
            if (edit.end <= oldIndex) {
                delta += edit.replacement.length() - (edit.end - edit.start);
            } else if (edit.start <= oldIndex) {
                // inside a replaced region, pinned to where the replacement starts
                return edit.start + delta;
            } else {
                break;
            }
        }
        return oldIndex + delta;
    }

    static final class Edit {
        private final int start;
        private final int end;
        private final String replacement;
        private final int order;
        private final List<EditAnchor> anchors = new ArrayList<>();
        private int newStart;

        private Edit(int start, int end, String replacement, int order) {
            this.start = start;
            this.end = end;
            this.replacement = replacement;
            this.order = order;
        }

        /**
         * Maps {@code offset} inside the replacement to the original position of
         * {@code sourceIndex} in the edited text.
         */
        Edit anchor(int offset, int sourceIndex, int length, MappingTag tag) {
            anchors.add(new EditAnchor(offset, sourceIndex, length, tag));
            return this;
        }
    }

    private record EditAnchor(int offset, int sourceIndex, int length, MappingTag tag) {
    }

    private record SourceAnchor(int sourceIndex, int length, MappingTag tag) {
    }
}
