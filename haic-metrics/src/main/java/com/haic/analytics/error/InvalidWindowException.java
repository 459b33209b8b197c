package com.haic.analytics.error;

/**
 * Raised for malformed or contradictory window specifications, including end before start.
 */
public class InvalidWindowException extends MetricsException {
    private static final long serialVersionUID = 1L;

    public InvalidWindowException(String reason, String message) {
        super(reason, message);
    }

    public InvalidWindowException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
