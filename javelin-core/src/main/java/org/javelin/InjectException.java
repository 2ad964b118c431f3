package org.javelin;

import org.javelin.mapping.Position;

public class InjectException extends TransformPhaseException {

    private final String declarationName;

    public InjectException(String pluginName, String declarationName, Throwable cause) {
        super("failed to inject declaration '" + declarationName + "'", pluginName, Position.UNKNOWN, cause);
        this.declarationName = declarationName;
    }

    public String getDeclarationName() {
        return declarationName;
    }
}
