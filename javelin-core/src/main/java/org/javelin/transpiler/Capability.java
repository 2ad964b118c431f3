package org.javelin.transpiler;

/**
 * Phases a {@link Plugin} takes part in. Declared once in the plugin's
 * {@link PluginDescriptor}; the pipeline builds its phase lists from them.
 */
public enum Capability {
    DISCOVER,
    TRANSFORM,
    DECLARATIONS,
    SHARED_CONTEXT
}
