package org.javelin;

public class JavelinException extends RuntimeException {

    public JavelinException(String message) {
        super(message);
    }

    public JavelinException(String message, Throwable cause) {
        super(message, cause);
    }

    public JavelinException(Throwable cause) {
        super(cause);
    }
}
