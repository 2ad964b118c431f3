package org.javelin.transpiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import org.javelin.JavelinConfig;
import org.javelin.PluginDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plugins in registration order, and their execution order resolved from the declared
 * dependencies.
 */
public class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final Map<String, Plugin> plugins = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if a plugin with the same name is already registered
     */
    public PluginRegistry register(Plugin plugin) {
        String name = plugin.descriptor().name();
        if (plugins.containsKey(name)) {
            throw new IllegalArgumentException("plugin '" + name + "' is already registered");
        }
        plugins.put(name, plugin);
        return this;
    }

    public List<Plugin> plugins() {
        return List.copyOf(plugins.values());
    }

    public List<Plugin> resolveOrder() {
        return resolveOrder(JavelinConfig.defaults());
    }

    /**
     * Orders the enabled plugins so that every plugin comes after its dependencies, using
     * Kahn's algorithm. Among plugins that are ready at the same time the one registered
     * first goes first, so the order is fully determined by the registrations.
     *
     * @throws PluginDependencyException on an unknown or disabled dependency, or a cycle
     */
    public List<Plugin> resolveOrder(JavelinConfig config) {
        Map<String, Integer> index = new HashMap<>();
        List<Plugin> enabled = new ArrayList<>();
        for (Plugin plugin : plugins.values()) {
            if (config.isPluginEnabled(plugin.name())) {
                index.put(plugin.name(), enabled.size());
                enabled.add(plugin);
            } else {
                log.debug("Plugin {} is disabled", plugin.name());
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (Plugin plugin : enabled) {
            inDegree.putIfAbsent(plugin.name(), 0);
            for (String dependency : plugin.descriptor().dependencies()) {
                if (!index.containsKey(dependency)) {
                    String reason = plugins.containsKey(dependency) ? "depends on disabled plugin" : "depends on unknown plugin";
                    throw new PluginDependencyException("plugin '" + plugin.name() + "' " + reason + " '" + dependency + "'",
                                                        List.of(plugin.name(), dependency));
                }
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(plugin.name());
                inDegree.merge(plugin.name(), 1, Integer::sum);
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparingInt(index::get));
        for (Plugin plugin : enabled) {
            if (inDegree.get(plugin.name()) == 0) {
                ready.add(plugin.name());
            }
        }
        List<Plugin> ordered = new ArrayList<>();
        while (!ready.isEmpty()) {
            String current = ready.poll();
            ordered.add(enabled.get(index.get(current)));
            for (String dependent : dependents.getOrDefault(current, Collections.emptyList())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() < enabled.size()) {
            List<String> cyclic = new ArrayList<>();
            for (Plugin plugin : enabled) {
                if (inDegree.get(plugin.name()) > 0) {
                    cyclic.add(plugin.name());
                }
            }
            throw new PluginDependencyException("plugin dependency cycle", cyclic);
        }
        log.debug("Resolved plugin order: {}", names(ordered));
        return ordered;
    }

    private static List<String> names(List<Plugin> plugins) {
        List<String> names = new ArrayList<>(plugins.size());
        for (Plugin plugin : plugins) {
            names.add(plugin.name());
        }
        return names;
    }
}
