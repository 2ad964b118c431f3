package org.javelin;

import org.javelin.mapping.Position;

public class TransformPhaseException extends JavelinException {

    private final String pluginName;
    private final Position position;

    public TransformPhaseException(String message, String pluginName, Position position, Throwable cause) {
        super("[" + pluginName + "] " + message + (position.isKnown() ? " at " + position : ""), cause);
        this.pluginName = pluginName;
        this.position = position;
    }

    public String getPluginName() {
        return pluginName;
    }

    /**
     * Position in the original source, or {@link Position#UNKNOWN}.
     */
    public Position getPosition() {
        return position;
    }
}
