package com.haic.analytics.interaction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Primary KPI vector.
 *
 * <p>Ranges: F, D, EL >= 0; HCL, Tr, S, EfficiencyScore in [0, 1]; A in [-1, 1].</p>
 */
public final class InteractionMetrics {
    public final double frequency;
    public final double meanDuration;
    public final double humanCenteredLatency;
    public final double trust;
    public final double adaptability;
    public final double similarity;
    public final double effortLoss;
    public final double efficiencyScore;

    public InteractionMetrics(
            double frequency,
            double meanDuration,
            double humanCenteredLatency,
            double trust,
            double adaptability,
            double similarity,
            double effortLoss,
            double efficiencyScore) {
        this.frequency = frequency;
        this.meanDuration = meanDuration;
        this.humanCenteredLatency = humanCenteredLatency;
        this.trust = trust;
        this.adaptability = adaptability;
        this.similarity = similarity;
        this.effortLoss = effortLoss;
        this.efficiencyScore = efficiencyScore;
    }

    public Map<String, Double> toMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("F", frequency);
        out.put("D", meanDuration);
        out.put("HCL", humanCenteredLatency);
        out.put("Tr", trust);
        out.put("A", adaptability);
        out.put("S", similarity);
        out.put("EL", effortLoss);
        out.put("EfficiencyScore", efficiencyScore);
        return out;
    }

    @Override
    public String toString() {
        return "InteractionMetrics" + toMap();
    }
}
