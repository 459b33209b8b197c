package com.haic.analytics.latency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Count, mean and p50/p90/p95 of one timing series. All zero when empty.
 */
public final class PercentileSummary {
    public static final double Q50 = 0.5;
    public static final double Q90 = 0.9;
    public static final double Q95 = 0.95;

    public final int n;
    public final double mean;
    public final double p50;
    public final double p90;
    public final double p95;

    PercentileSummary(int n, double mean, double p50, double p90, double p95) {
        this.n = n;
        this.mean = mean;
        this.p50 = p50;
        this.p90 = p90;
        this.p95 = p95;
    }

    public static PercentileSummary of(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return new PercentileSummary(0, 0.0, 0.0, 0.0, 0.0);
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        double sum = 0.0;
        for (double value : sorted) {
            sum += value;
        }
        return new PercentileSummary(
                sorted.size(),
                sum / sorted.size(),
                Percentiles.linearSorted(sorted, Q50),
                Percentiles.linearSorted(sorted, Q90),
                Percentiles.linearSorted(sorted, Q95));
    }

    /**
     * Flat keys such as {@code human_rt_p50_s}: {@code prefix + "_" + stat + "_" + unit}, with
     * the count as {@code prefix + "_n"}.
     */
    public Map<String, Double> toMap(String prefix, String unit) {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put(prefix + "_n", (double) n);
        out.put(prefix + "_mean_" + unit, mean);
        out.put(prefix + "_p50_" + unit, p50);
        out.put(prefix + "_p90_" + unit, p90);
        out.put(prefix + "_p95_" + unit, p95);
        return out;
    }
}
