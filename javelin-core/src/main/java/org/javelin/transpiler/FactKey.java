package org.javelin.transpiler;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Typed handle to one slot of per-file state in {@link PipelineContext#facts(FactKey)}.
 * Keys compare by identity, so each plugin declares its own as a constant.
 */
public final class FactKey<T> {

    private final String name;
    private final Class<T> type;
    private final Supplier<? extends T> factory;

    private FactKey(String name, Class<T> type, Supplier<? extends T> factory) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.factory = Objects.requireNonNull(factory);
    }

    public static <T> FactKey<T> of(String name, Class<T> type, Supplier<? extends T> factory) {
        return new FactKey<>(name, type, factory);
    }

    public String name() {
        return name;
    }

    T create() {
        return type.cast(factory.get());
    }

    T cast(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return "FactKey[" + name + ", " + type.getSimpleName() + "]";
    }
}
