package org.javelin.mapping;

/**
 * Kind of source span a {@link Mapping} anchors. The span rank orders tags from the
 * smallest syntactic span to the largest and breaks ties between equally near mappings.
 */
public enum MappingTag {

    /**
     * Single-point marker: anchors one token whose generated span may be discontiguous,
     * so no column arithmetic is ever applied to it.
     */
    MARKER(0),
    TOKEN(1),
    PATTERN(2),
    EXPRESSION(3),
    STATEMENT(4),
    DECLARATION(5);

    private final int spanRank;

    MappingTag(int spanRank) {
        this.spanRank = spanRank;
    }

    public int getSpanRank() {
        return spanRank;
    }

    public boolean isMarker() {
        return this == MARKER;
    }
}
