package org.javelin;

import org.javelin.mapping.Position;

public class TransformException extends TransformPhaseException {

    public TransformException(String message, String pluginName, Position position, Throwable cause) {
        super(message, pluginName, position, cause);
    }
}
