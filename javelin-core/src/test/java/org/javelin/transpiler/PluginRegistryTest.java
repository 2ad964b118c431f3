package org.javelin.transpiler;

import java.util.ArrayList;
import java.util.List;

import org.javelin.JavelinConfig;
import org.javelin.PluginDependencyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PluginRegistryTest {

    private final List<String> log = new ArrayList<>();

    private RecordingPlugin plugin(String name, String... dependencies) {
        return new RecordingPlugin(name, log, List.of(dependencies), Capability.DISCOVER);
    }

    private static List<String> names(List<Plugin> plugins) {
        List<String> names = new ArrayList<>();
        for (Plugin plugin : plugins) {
            names.add(plugin.name());
        }
        return names;
    }

    @Test
    void dependency_runsFirstWhateverTheRegistrationOrder() {
        PluginRegistry registry = new PluginRegistry().register(plugin("b", "a")).register(plugin("a"));

        assertThat(names(registry.resolveOrder())).containsExactly("a", "b");
        assertThat(names(registry.plugins())).containsExactly("b", "a");
    }

    @Test
    void independentPlugins_keepRegistrationOrder() {
        PluginRegistry registry = new PluginRegistry().register(plugin("x")).register(plugin("y")).register(plugin("z"));

        assertThat(names(registry.resolveOrder())).containsExactly("x", "y", "z");
    }

    @Test
    void diamond_isOrderedDeterministically() {
        PluginRegistry registry = new PluginRegistry()
                .register(plugin("d", "b", "c"))
                .register(plugin("c", "a"))
                .register(plugin("b", "a"))
                .register(plugin("a"));

        assertThat(names(registry.resolveOrder())).containsExactly("a", "c", "b", "d");
    }

    @Test
    void unknownDependency_isFatal() {
        PluginRegistry registry = new PluginRegistry().register(plugin("b", "missing"));

        assertThatThrownBy(registry::resolveOrder)
            .isInstanceOf(PluginDependencyException.class)
            .hasMessage("plugin 'b' depends on unknown plugin 'missing': b, missing")
            .satisfies(e -> assertThat(((PluginDependencyException) e).getPlugins()).containsExactly("b", "missing"));
    }

    @Test
    void disabledDependency_isFatal() {
        PluginRegistry registry = new PluginRegistry().register(plugin("a")).register(plugin("b", "a"));
        JavelinConfig config = JavelinConfig.builder().disablePlugin("a").build();

        assertThatThrownBy(() -> registry.resolveOrder(config))
            .isInstanceOf(PluginDependencyException.class)
            .hasMessageContaining("depends on disabled plugin 'a'");
    }

    @Test
    void disabledPlugin_isLeftOut() {
        PluginRegistry registry = new PluginRegistry().register(plugin("a")).register(plugin("b"));
        JavelinConfig config = JavelinConfig.builder().disablePlugin("a").build();

        assertThat(names(registry.resolveOrder(config))).containsExactly("b");
    }

    @Test
    void cycle_namesTheCyclicPlugins() {
        PluginRegistry registry = new PluginRegistry()
                .register(plugin("free"))
                .register(plugin("a", "b"))
                .register(plugin("b", "a"));

        assertThatThrownBy(registry::resolveOrder)
            .isInstanceOf(PluginDependencyException.class)
            .hasMessage("plugin dependency cycle: a, b");
    }

    @Test
    void duplicateName_isRejected() {
        PluginRegistry registry = new PluginRegistry().register(plugin("a"));

        assertThatThrownBy(() -> registry.register(plugin("a")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("plugin 'a' is already registered");
    }

    @Test
    void descriptor_rejectsBlankName() {
        assertThatThrownBy(() -> PluginDescriptor.of(" ", "nothing", List.of(), Capability.DISCOVER))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
