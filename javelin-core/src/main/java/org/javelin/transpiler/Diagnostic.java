package org.javelin.transpiler;

import org.javelin.mapping.Position;

/**
 * A non-fatal finding, positioned in the original source.
 */
public record Diagnostic(Severity severity, String plugin, String message, Position position) {

    public enum Severity {
        INFO,
        WARNING
    }

    @Override
    public String toString() {
        return severity + " [" + plugin + "] " + message + (position.isKnown() ? " at " + position : "");
    }
}
