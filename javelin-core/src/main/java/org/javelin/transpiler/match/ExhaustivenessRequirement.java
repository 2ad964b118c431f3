package org.javelin.transpiler.match;

import java.util.ArrayList;
import java.util.List;

/**
 * Legal variant tags per column, in declaration order. An empty list means the column is
 * not a union value, so only wildcards and bindings can cover it.
 */
public record ExhaustivenessRequirement(List<List<String>> columns) {

    public ExhaustivenessRequirement {
        List<List<String>> copy = new ArrayList<>(columns.size());
        for (List<String> tags : columns) {
            copy.add(List.copyOf(tags));
        }
        columns = List.copyOf(copy);
    }

    @SafeVarargs
    public static ExhaustivenessRequirement of(List<String>... columns) {
        return new ExhaustivenessRequirement(List.of(columns));
    }

    public int arity() {
        return columns.size();
    }

    public List<String> tags(int column) {
        return columns.get(column);
    }
}
