package org.javelin.transpiler.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A tagged union known to the current file, either declared by the user or one of the
 * builtin {@code Option} and {@code Result} unions ({@code synthetic == true}).
 */
public record UnionInfo(String name, List<String> typeParameters, List<VariantInfo> variants, boolean synthetic) {

    public UnionInfo {
        typeParameters = List.copyOf(typeParameters);
        variants = List.copyOf(variants);
    }

    public boolean isGeneric() {
        return !typeParameters.isEmpty();
    }

    public Optional<VariantInfo> variant(String tag) {
        for (VariantInfo variant : variants) {
            if (variant.tag().equals(tag)) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }

    /**
     * Variant tags in declaration order.
     */
    public List<String> tags() {
        List<String> tags = new ArrayList<>(variants.size());
        for (VariantInfo variant : variants) {
            tags.add(variant.tag());
        }
        return tags;
    }
}
