package org.javelin;

import java.util.List;

import org.javelin.mapping.Position;

public class ExhaustivenessException extends JavelinException {

    private final List<String> missing;
    private final Position position;

    public ExhaustivenessException(List<String> missing, Position position) {
        super("non-exhaustive match, missing " + describe(missing) + (position.isKnown() ? " at " + position : ""));
        this.missing = List.copyOf(missing);
        this.position = position;
    }

    private static String describe(List<String> missing) {
        return missing.size() == 1 ? missing.get(0) : "(" + String.join(", ", missing) + ")";
    }

    /**
     * The first uncovered combination, one entry per column; {@code _} marks a column with
     * no union requirement.
     */
    public List<String> getMissing() {
        return missing;
    }

    public Position getPosition() {
        return position;
    }
}
