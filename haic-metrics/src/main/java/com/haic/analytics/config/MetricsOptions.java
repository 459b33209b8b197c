package com.haic.analytics.config;

import com.haic.analytics.interaction.InteractionMetricEngine;
import com.haic.analytics.window.WindowSpec;

import java.util.Locale;
import java.util.Map;

/**
 * Options recognized by the metrics orchestrator. Instances are immutable; use the {@code with*}
 * methods to derive variants.
 */
public final class MetricsOptions {
    public static final String ENV_PROFILE = "HAIC_METRICS_PROFILE";
    public static final String ENV_RT_MAX_S = "HAIC_METRICS_RT_MAX_S";
    public static final String ENV_BASELINE_S = "HAIC_METRICS_BASELINE_S";
    public static final String ENV_INCLUDE_WARNINGS = "HAIC_METRICS_INCLUDE_WARNINGS";

    public final Profile profile;
    public final double rtMaxS;
    /** Expected session length for effort loss; null disables EL. */
    public final Double baselineS;
    public final boolean includeWarnings;
    /** Null means no window. */
    public final WindowSpec window;

    private MetricsOptions(Profile profile, double rtMaxS, Double baselineS, boolean includeWarnings, WindowSpec window) {
        this.profile = profile;
        this.rtMaxS = rtMaxS;
        this.baselineS = baselineS;
        this.includeWarnings = includeWarnings;
        this.window = window;
    }

    public static MetricsOptions defaults() {
        return new MetricsOptions(Profile.CORE, InteractionMetricEngine.DEFAULT_RT_MAX_S, null, true, null);
    }

    public static MetricsOptions fromEnv() {
        return fromEnv(System.getenv());
    }

    static MetricsOptions fromEnv(Map<String, String> env) {
        String profile = env(env, ENV_PROFILE, "core");
        double rtMaxS = envPositiveDouble(env, ENV_RT_MAX_S, InteractionMetricEngine.DEFAULT_RT_MAX_S);
        Double baselineS = envNullableDouble(env, ENV_BASELINE_S);
        boolean includeWarnings = envBoolean(env, ENV_INCLUDE_WARNINGS, true);
        return new MetricsOptions(Profile.fromValue(profile), rtMaxS, baselineS, includeWarnings, null);
    }

    public MetricsOptions withProfile(Profile profile) {
        return new MetricsOptions(profile, rtMaxS, baselineS, includeWarnings, window);
    }

    public MetricsOptions withProfile(String profile) {
        return withProfile(Profile.fromValue(profile));
    }

    public MetricsOptions withRtMaxS(double rtMaxS) {
        return new MetricsOptions(profile, rtMaxS, baselineS, includeWarnings, window);
    }

    public MetricsOptions withBaselineS(Double baselineS) {
        return new MetricsOptions(profile, rtMaxS, baselineS, includeWarnings, window);
    }

    public MetricsOptions withIncludeWarnings(boolean includeWarnings) {
        return new MetricsOptions(profile, rtMaxS, baselineS, includeWarnings, window);
    }

    public MetricsOptions withWindow(WindowSpec window) {
        return new MetricsOptions(profile, rtMaxS, baselineS, includeWarnings, window);
    }

    private static String env(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static double envPositiveDouble(Map<String, String> env, String key, double defaultValue) {
        Double value = envNullableDouble(env, key);
        return value == null || value <= 0.0 ? defaultValue : value;
    }

    private static Double envNullableDouble(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static boolean envBoolean(Map<String, String> env, String key, boolean defaultValue) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("false".equals(normalized) || "0".equals(normalized) || "no".equals(normalized)) {
            return false;
        }
        if ("true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized)) {
            return true;
        }
        return defaultValue;
    }

    @Override
    public String toString() {
        return "MetricsOptions{profile=" + profile.wireName()
                + ", rtMaxS=" + rtMaxS
                + ", baselineS=" + baselineS
                + ", includeWarnings=" + includeWarnings
                + ", window=" + window
                + "}";
    }
}
