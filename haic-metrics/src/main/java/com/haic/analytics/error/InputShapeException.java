package com.haic.analytics.error;

/**
 * Raised when the decisions container is not a list or an artifact lacks a decisions array.
 */
public class InputShapeException extends MetricsException {
    private static final long serialVersionUID = 1L;

    public InputShapeException(String reason, String message) {
        super(reason, message);
    }

    public InputShapeException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
