package org.javelin.transpiler.types;

import java.util.List;

public record VariantInfo(String union, String tag, List<VariantField> fields) {

    public VariantInfo {
        fields = List.copyOf(fields);
    }

    public int arity() {
        return fields.size();
    }

    /**
     * Name of the nested record, e.g. {@code Shape.Circle}.
     */
    public String qualifiedName() {
        return union + "." + tag;
    }
}
