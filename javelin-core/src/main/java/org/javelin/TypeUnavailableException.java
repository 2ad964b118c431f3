package org.javelin;

/**
 * Soft failure: neither the type oracle nor the structural heuristics could type an
 * expression whose type is needed to generate code.
 */
public class TypeUnavailableException extends JavelinException {

    private final String expression;
    private final String purpose;

    public TypeUnavailableException(String expression, String purpose) {
        super("type required but unavailable for '" + expression + "' (" + purpose + ")");
        this.expression = expression;
        this.purpose = purpose;
    }

    public String getExpression() {
        return expression;
    }

    public String getPurpose() {
        return purpose;
    }
}
