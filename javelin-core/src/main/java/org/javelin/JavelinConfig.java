package org.javelin;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable settings for one {@link Javelin} instance.
 */
public final class JavelinConfig {

    public static final String MAX_ARITY_KEY = "javelin.match.maxArity";
    public static final String MAX_COMBINATIONS_KEY = "javelin.match.maxCombinations";
    public static final String TYPES_ENABLED_KEY = "javelin.types.enabled";
    public static final String DISABLED_PLUGINS_KEY = "javelin.plugins.disabled";

    public static final int DEFAULT_MAX_TUPLE_ARITY = 6;
    public static final int DEFAULT_MAX_COMBINATIONS = 1024;

    private static final JavelinConfig DEFAULTS = builder().build();

    private final int maxTupleArity;
    private final int maxCombinations;
    private final boolean typeCheckEnabled;
    private final Set<String> disabledPlugins;

    private JavelinConfig(Builder builder) {
        this.maxTupleArity = builder.maxTupleArity;
        this.maxCombinations = builder.maxCombinations;
        this.typeCheckEnabled = builder.typeCheckEnabled;
        this.disabledPlugins = Set.copyOf(builder.disabledPlugins);
    }

    public static JavelinConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the {@code javelin.*} keys; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a numeric key does not hold a positive integer
     */
    public static JavelinConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String arity = properties.getProperty(MAX_ARITY_KEY);
        if (arity != null) {
            builder.maxTupleArity(parsePositive(MAX_ARITY_KEY, arity));
        }
        String combinations = properties.getProperty(MAX_COMBINATIONS_KEY);
        if (combinations != null) {
            builder.maxCombinations(parsePositive(MAX_COMBINATIONS_KEY, combinations));
        }
        String types = properties.getProperty(TYPES_ENABLED_KEY);
        if (types != null) {
            builder.typeCheckEnabled(Boolean.parseBoolean(types.trim()));
        }
        String disabled = properties.getProperty(DISABLED_PLUGINS_KEY);
        if (disabled != null) {
            Arrays.stream(disabled.split(","))
                  .map(String::trim)
                  .filter(s -> !s.isEmpty())
                  .forEach(builder::disablePlugin);
        }
        return builder.build();
    }

    private static int parsePositive(String key, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new IllegalArgumentException(key + " must be positive, was " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: '" + value + "'", e);
        }
    }

    public int getMaxTupleArity() {
        return maxTupleArity;
    }

    public int getMaxCombinations() {
        return maxCombinations;
    }

    public boolean isTypeCheckEnabled() {
        return typeCheckEnabled;
    }

    public Set<String> getDisabledPlugins() {
        return disabledPlugins;
    }

    public boolean isPluginEnabled(String name) {
        return !disabledPlugins.contains(name);
    }

    @Override
    public String toString() {
        return "JavelinConfig{" +
               "maxTupleArity=" + maxTupleArity +
               ", maxCombinations=" + maxCombinations +
               ", typeCheckEnabled=" + typeCheckEnabled +
               ", disabledPlugins=" + disabledPlugins.stream().sorted().collect(Collectors.joining(",", "[", "]")) +
               '}';
    }

    public static final class Builder {
        private int maxTupleArity = DEFAULT_MAX_TUPLE_ARITY;
        private int maxCombinations = DEFAULT_MAX_COMBINATIONS;
        private boolean typeCheckEnabled = true;
        private final Set<String> disabledPlugins = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder maxTupleArity(int maxTupleArity) {
            if (maxTupleArity < 1) {
                throw new IllegalArgumentException("maxTupleArity must be at least 1");
            }
            this.maxTupleArity = maxTupleArity;
            return this;
        }

        public Builder maxCombinations(int maxCombinations) {
            if (maxCombinations < 1) {
                throw new IllegalArgumentException("maxCombinations must be at least 1");
            }
            this.maxCombinations = maxCombinations;
            return this;
        }

        public Builder typeCheckEnabled(boolean typeCheckEnabled) {
            this.typeCheckEnabled = typeCheckEnabled;
            return this;
        }

        public Builder disablePlugin(String name) {
            this.disabledPlugins.add(name);
            return this;
        }

        public JavelinConfig build() {
            return new JavelinConfig(this);
        }
    }
}
