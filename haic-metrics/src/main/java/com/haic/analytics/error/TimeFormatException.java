package com.haic.analytics.error;

/**
 * Raised when a time value is neither epoch seconds nor a parseable ISO-8601 string.
 */
public class TimeFormatException extends MetricsException {
    private static final long serialVersionUID = 1L;

    public TimeFormatException(String reason, String message) {
        super(reason, message);
    }

    public TimeFormatException(String reason, String message, Throwable cause) {
        super(reason, message, cause);
    }
}
