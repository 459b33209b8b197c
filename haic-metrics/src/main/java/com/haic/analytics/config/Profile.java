package com.haic.analytics.config;

import com.haic.analytics.error.UnknownProfileException;

import java.util.Locale;

/**
 * Metric catalogue selection. {@code full} adds the outcome/confusion metrics to {@code core}.
 */
public enum Profile {
    CORE,
    FULL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Profile fromValue(String raw) {
        if (raw == null) {
            return CORE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("core".equals(normalized)) {
            return CORE;
        }
        if ("full".equals(normalized)) {
            return FULL;
        }
        throw new UnknownProfileException("unknown_profile", "profile must be 'core' or 'full': " + raw);
    }
}
