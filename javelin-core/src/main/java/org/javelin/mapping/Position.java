package org.javelin.mapping;

/**
 * A 1-based line/column pair, in either original or generated coordinates.
 */
public record Position(int line, int column) {

    public static final Position UNKNOWN = new Position(0, 0);

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
