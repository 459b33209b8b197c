package com.haic.analytics.error;

/**
 * Base type for fatal metric computation failures.
 *
 * <p>The {@code reason} is a stable snake_case code suitable for diagnostics and tests; the
 * message is human readable.</p>
 */
public class MetricsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String reason;

    public MetricsException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public MetricsException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
