package org.javelin;

import org.javelin.mapping.Position;

/**
 * The rewritten text was rejected by the structural parser. The position has already been
 * translated back to the original source.
 */
public class SourceParseException extends JavelinException {

    private final Position position;
    private final String problems;

    public SourceParseException(String message, Position position, String problems) {
        super(message + " at " + position + ": " + problems);
        this.position = position;
        this.problems = problems;
    }

    public Position getPosition() {
        return position;
    }

    public String getProblems() {
        return problems;
    }
}
