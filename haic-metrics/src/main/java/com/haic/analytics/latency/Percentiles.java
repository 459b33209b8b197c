package com.haic.analytics.latency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Linear-interpolation percentiles: rank {@code i = (n - 1) * q}, interpolated between the
 * floor and ceil ranks.
 */
public final class Percentiles {
    private Percentiles() {}

    /**
     * @return the q-quantile of {@code values}, or null when empty
     */
    public static Double linear(List<Double> values, double q) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        return linearSorted(sorted, q);
    }

    static Double linearSorted(List<Double> sorted, double q) {
        if (sorted.isEmpty()) {
            return null;
        }
        double rank = (sorted.size() - 1) * q;
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        if (lo == hi) {
            return sorted.get(lo);
        }
        double fraction = rank - lo;
        return sorted.get(lo) * (1.0 - fraction) + sorted.get(hi) * fraction;
    }
}
