package org.javelin.mapping;

import java.util.Objects;

/**
 * One original-to-generated position correspondence. Immutable: moving a mapping makes a
 * new one, which {@link MappingStore#shift(int, int)} puts in place of the old.
 */
public final class Mapping {

    private final int originalLine;
    private final int originalColumn;
    private final int generatedLine;
    private final int generatedColumn;
    private final int length;
    private final MappingTag tag;

    public Mapping(int originalLine, int originalColumn, int generatedLine, int generatedColumn, int length, MappingTag tag) {
        if (length < 0) {
            throw new IllegalArgumentException("mapping length must be >= 0, was " + length);
        }
        this.originalLine = originalLine;
        this.originalColumn = originalColumn;
        this.generatedLine = generatedLine;
        this.generatedColumn = generatedColumn;
        this.length = length;
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    public static Mapping marker(Position original, Position generated) {
        return new Mapping(original.line(), original.column(), generated.line(), generated.column(), 1, MappingTag.MARKER);
    }

    public static Mapping span(Position original, Position generated, int length, MappingTag tag) {
        return new Mapping(original.line(), original.column(), generated.line(), generated.column(), length, tag);
    }

    public int getOriginalLine() {
        return originalLine;
    }

    public int getOriginalColumn() {
        return originalColumn;
    }

    public int getGeneratedLine() {
        return generatedLine;
    }

    public int getGeneratedColumn() {
        return generatedColumn;
    }

    public int getLength() {
        return length;
    }

    public MappingTag getTag() {
        return tag;
    }

    public Position original() {
        return new Position(originalLine, originalColumn);
    }

    public Position generated() {
        return new Position(generatedLine, generatedColumn);
    }

    /**
     * Copy with a different generated column, used by text rewriters that edit a line to
     * the left of this mapping.
     */
    public Mapping withGeneratedColumn(int column) {
        return new Mapping(originalLine, originalColumn, generatedLine, column, length, tag);
    }

    Mapping shiftGeneratedLine(int byLines) {
        return new Mapping(originalLine, originalColumn, generatedLine + byLines, generatedColumn, length, tag);
    }

    boolean containsGenerated(int line, int column) {
        return generatedLine == line && column >= generatedColumn && column < generatedColumn + length;
    }

    boolean containsOriginal(int line, int column) {
        return originalLine == line && column >= originalColumn && column < originalColumn + length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Mapping that = (Mapping) o;
        return originalLine == that.originalLine &&
               originalColumn == that.originalColumn &&
               generatedLine == that.generatedLine &&
               generatedColumn == that.generatedColumn &&
               length == that.length &&
               tag == that.tag;
    }

    @Override
    public int hashCode() {
        return Objects.hash(originalLine, originalColumn, generatedLine, generatedColumn, length, tag);
    }

    @Override
    public String toString() {
        return "Mapping{" +
               "original=" + originalLine + ":" + originalColumn +
               ", generated=" + generatedLine + ":" + generatedColumn +
               ", length=" + length +
               ", tag=" + tag +
               '}';
    }
}
