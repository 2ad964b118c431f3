package org.javelin;

public class LimitExceededException extends JavelinException {

    private final String limit;
    private final long actual;
    private final long maximum;

    public LimitExceededException(String limit, long actual, long maximum, String message) {
        super(message);
        this.limit = limit;
        this.actual = actual;
        this.maximum = maximum;
    }

    public String getLimit() {
        return limit;
    }

    public long getActual() {
        return actual;
    }

    public long getMaximum() {
        return maximum;
    }
}
