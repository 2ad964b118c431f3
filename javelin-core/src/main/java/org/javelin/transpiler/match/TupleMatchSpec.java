package org.javelin.transpiler.match;

import java.util.List;

/**
 * The rows of one match, in arm order. Every row has exactly {@link #arity()} columns.
 */
public record TupleMatchSpec(int arity, List<PatternRow> rows) {

    public TupleMatchSpec {
        if (arity < 1) {
            throw new IllegalArgumentException("arity must be at least 1, was " + arity);
        }
        rows = List.copyOf(rows);
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).arity() != arity) {
                throw new IllegalArgumentException("row " + i + " has " + rows.get(i).arity() + " columns, expected " + arity);
            }
        }
    }
}
