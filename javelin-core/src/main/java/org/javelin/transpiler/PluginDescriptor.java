package org.javelin.transpiler;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public record PluginDescriptor(String name, String description, List<String> dependencies, Set<Capability> capabilities) {

    public PluginDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("plugin name must not be empty");
        }
        dependencies = List.copyOf(dependencies);
        capabilities = capabilities.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    public static PluginDescriptor of(String name, String description, List<String> dependencies, Capability first, Capability... rest) {
        return new PluginDescriptor(name, description, dependencies, EnumSet.of(first, rest));
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }
}
