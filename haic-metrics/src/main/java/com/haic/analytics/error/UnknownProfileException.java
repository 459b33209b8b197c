package com.haic.analytics.error;

/**
 * Raised when the requested metric profile is not one of {@code core} or {@code full}.
 */
public class UnknownProfileException extends MetricsException {
    private static final long serialVersionUID = 1L;

    public UnknownProfileException(String reason, String message) {
        super(reason, message);
    }

    public UnknownProfileException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
