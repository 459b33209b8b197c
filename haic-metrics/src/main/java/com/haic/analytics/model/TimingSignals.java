package com.haic.analytics.model;

/**
 * Unit conversions between the mutually convertible timing fields.
 *
 * <p>Invariant: {@code latency_ms == duration_s * 1000}.</p>
 */
public final class TimingSignals {
    /** Bare latency values at or above this are taken as milliseconds, below as seconds. */
    public static final double BARE_LATENCY_MS_THRESHOLD = 500.0;

    private TimingSignals() {}

    public static Double secondsToMs(Double seconds) {
        return seconds == null ? null : seconds * 1000.0;
    }

    public static Double msToSeconds(Double millis) {
        return millis == null ? null : millis / 1000.0;
    }

    public static Double bareLatencyToMs(Double latency) {
        if (latency == null) {
            return null;
        }
        return latency >= BARE_LATENCY_MS_THRESHOLD ? latency : latency * 1000.0;
    }
}
