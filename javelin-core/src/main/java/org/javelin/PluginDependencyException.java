package org.javelin;

import java.util.List;

/**
 * Fatal configuration error: a plugin depends on an unknown plugin, or plugins depend on
 * each other in a cycle.
 */
public class PluginDependencyException extends JavelinException {

    private final List<String> plugins;

    public PluginDependencyException(String message, List<String> plugins) {
        super(message + ": " + String.join(", ", plugins));
        this.plugins = List.copyOf(plugins);
    }

    public List<String> getPlugins() {
        return plugins;
    }
}
