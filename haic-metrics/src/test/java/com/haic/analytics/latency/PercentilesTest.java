package com.haic.analytics.latency;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PercentilesTest {

    @Test
    void linearInterpolatesBetweenRanks() {
        assertEquals(2.5, Percentiles.linear(Arrays.asList(4.0, 1.0, 3.0, 2.0), 0.5));
        assertEquals(3.7, Percentiles.linear(Arrays.asList(1.0, 2.0, 3.0, 4.0), 0.9), 1e-9);
        assertEquals(7.0, Percentiles.linear(Collections.singletonList(7.0), 0.95));
        assertNull(Percentiles.linear(Collections.emptyList(), 0.5));
    }

    @Test
    void summaryOfEmptyInputIsAllZero() {
        PercentileSummary summary = PercentileSummary.of(Collections.emptyList());

        assertEquals(0, summary.n);
        assertEquals(0.0, summary.mean);
        assertEquals(0.0, summary.p95);
    }

    @Test
    void summaryKeysCarryPrefixAndUnit() {
        Map<String, Double> out = PercentileSummary.of(Arrays.asList(1.0, 3.0)).toMap("human_rt", "s");

        assertEquals(2.0, out.get("human_rt_n"));
        assertEquals(2.0, out.get("human_rt_mean_s"));
        assertEquals(2.0, out.get("human_rt_p50_s"));
        assertEquals(2.8, out.get("human_rt_p90_s"), 1e-9);
        assertEquals(2.9, out.get("human_rt_p95_s"), 1e-9);
    }
}
