package com.haic.analytics.util;

import java.util.Locale;

/**
 * Shared string semantics for blank handling, canonical labels and deterministic fallbacks.
 */
public final class StringSemantics {
    private StringSemantics() {}

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return "";
    }

    /**
     * Canonical label form: trimmed, lower-cased, {@code &} spelled as {@code and}, inner
     * whitespace runs collapsed to one space. Returns null for null input.
     */
    public static String canonical(String value) {
        if (value == null) {
            return null;
        }
        String s = value.trim().toLowerCase(Locale.ROOT).replace("&", "and");
        return s.replaceAll("\\s+", " ");
    }

    public static String lowerOrEmpty(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
