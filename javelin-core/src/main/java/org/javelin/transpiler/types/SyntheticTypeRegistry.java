package org.javelin.transpiler.types;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unions visible in one file. Builtin unions are registered first and are replaced when
 * the user declares a union of the same name.
 */
public class SyntheticTypeRegistry {

    private final Map<String, UnionInfo> unions = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if a user union of the same name is already registered
     */
    public void register(UnionInfo union) {
        UnionInfo existing = unions.get(union.name());
        if (existing != null && !existing.synthetic()) {
            if (union.synthetic()) {
                return;
            }
            throw new IllegalArgumentException("union '" + union.name() + "' is declared more than once");
        }
        unions.put(union.name(), union);
    }

    public void remove(String name) {
        unions.remove(name);
    }

    public Optional<UnionInfo> union(String name) {
        return Optional.ofNullable(unions.get(simpleName(name)));
    }

    public boolean isUnion(String name) {
        return unions.containsKey(simpleName(name));
    }

    public boolean isSynthetic(String name) {
        UnionInfo union = unions.get(simpleName(name));
        return union != null && union.synthetic();
    }

    public Collection<UnionInfo> unions() {
        return Collections.unmodifiableCollection(unions.values());
    }

    /**
     * Every variant with this tag, across all unions, in registration order.
     */
    public List<VariantInfo> variantsNamed(String tag) {
        List<VariantInfo> found = new ArrayList<>();
        for (UnionInfo union : unions.values()) {
            union.variant(tag).ifPresent(found::add);
        }
        return found;
    }

    /**
     * Strips package or outer class qualifiers and type arguments: {@code a.b.Result<X, Y>}
     * becomes {@code Result}.
     */
    public static String simpleName(String typeName) {
        String raw = typeName;
        int generic = raw.indexOf('<');
        if (generic >= 0) {
            raw = raw.substring(0, generic);
        }
        int dot = raw.lastIndexOf('.');
        return (dot >= 0 ? raw.substring(dot + 1) : raw).trim();
    }
}
