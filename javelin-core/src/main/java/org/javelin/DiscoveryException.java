package org.javelin;

import org.javelin.mapping.Position;

public class DiscoveryException extends TransformPhaseException {

    public DiscoveryException(String message, String pluginName, Position position, Throwable cause) {
        super(message, pluginName, position, cause);
    }
}
