package org.javelin.transpiler.match;

/**
 * What the exhaustiveness checker sees of one pattern column: a variant tag or a wildcard.
 */
public record ColumnPattern(String tag) {

    private static final ColumnPattern WILDCARD = new ColumnPattern(null);

    public static ColumnPattern wildcard() {
        return WILDCARD;
    }

    public static ColumnPattern tag(String tag) {
        return new ColumnPattern(tag);
    }

    public static ColumnPattern of(Pattern pattern) {
        return pattern instanceof Pattern.Variant ? tag(((Pattern.Variant) pattern).tag()) : WILDCARD;
    }

    public boolean isWildcard() {
        return tag == null;
    }

    public boolean covers(String candidate) {
        return tag == null || tag.equals(candidate);
    }

    @Override
    public String toString() {
        return tag == null ? "_" : tag;
    }
}
