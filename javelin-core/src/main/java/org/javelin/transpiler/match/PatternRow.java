package org.javelin.transpiler.match;

import java.util.ArrayList;
import java.util.List;

public record PatternRow(List<ColumnPattern> columns, boolean guarded) {

    public PatternRow {
        columns = List.copyOf(columns);
    }

    public static PatternRow of(boolean guarded, String... columns) {
        List<ColumnPattern> list = new ArrayList<>();
        for (String column : columns) {
            list.add("_".equals(column) ? ColumnPattern.wildcard() : ColumnPattern.tag(column));
        }
        return new PatternRow(list, guarded);
    }

    public static PatternRow of(String... columns) {
        return of(false, columns);
    }

    public int arity() {
        return columns.size();
    }

    public ColumnPattern column(int index) {
        return columns.get(index);
    }

    boolean isWildcardFrom(int column) {
        for (int i = column; i < columns.size(); i++) {
            if (!columns.get(i).isWildcard()) {
                return false;
            }
        }
        return true;
    }
}
