package com.haic.analytics.outcome;

import java.util.Locale;

/**
 * True/false positive/negative tallies. A single record contributes at most one unit.
 */
public final class ConfusionCounts {
    public static final ConfusionCounts NONE = new ConfusionCounts(0, 0, 0, 0);
    public static final ConfusionCounts TRUE_POSITIVE = new ConfusionCounts(1, 0, 0, 0);
    public static final ConfusionCounts FALSE_POSITIVE = new ConfusionCounts(0, 1, 0, 0);
    public static final ConfusionCounts TRUE_NEGATIVE = new ConfusionCounts(0, 0, 1, 0);
    public static final ConfusionCounts FALSE_NEGATIVE = new ConfusionCounts(0, 0, 0, 1);

    public final int tp;
    public final int fp;
    public final int tn;
    public final int fn;

    public ConfusionCounts(int tp, int fp, int tn, int fn) {
        this.tp = tp;
        this.fp = fp;
        this.tn = tn;
        this.fn = fn;
    }

    /**
     * Maps {@code true_positive/tp}, {@code false_positive/fp}, ... to a one-hot contribution;
     * null for anything else.
     */
    public static ConfusionCounts fromResultLabel(String label) {
        if (label == null) {
            return null;
        }
        switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "true_positive":
            case "tp":
                return TRUE_POSITIVE;
            case "false_positive":
            case "fp":
                return FALSE_POSITIVE;
            case "true_negative":
            case "tn":
                return TRUE_NEGATIVE;
            case "false_negative":
            case "fn":
                return FALSE_NEGATIVE;
            default:
                return null;
        }
    }

    public static ConfusionCounts fromPair(boolean predictedPositive, boolean actualPositive) {
        if (predictedPositive) {
            return actualPositive ? TRUE_POSITIVE : FALSE_POSITIVE;
        }
        return actualPositive ? FALSE_NEGATIVE : TRUE_NEGATIVE;
    }

    public ConfusionCounts plus(ConfusionCounts other) {
        return new ConfusionCounts(tp + other.tp, fp + other.fp, tn + other.tn, fn + other.fn);
    }

    public int total() {
        return tp + fp + tn + fn;
    }

    public boolean isCorrect() {
        return tp + tn > 0;
    }

    public double precision() {
        return tp + fp > 0 ? (double) tp / (tp + fp) : 0.0;
    }

    public double recall() {
        return tp + fn > 0 ? (double) tp / (tp + fn) : 0.0;
    }

    @Override
    public String toString() {
        return "ConfusionCounts{tp=" + tp + ", fp=" + fp + ", tn=" + tn + ", fn=" + fn + "}";
    }
}
