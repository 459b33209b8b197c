package com.haic.analytics.interaction;

import com.haic.analytics.model.DecisionRecord;
import com.haic.analytics.parse.JsonNodeUtils;
import com.haic.analytics.parse.RecordNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Computes the interaction KPI vector (F, D, HCL, Tr, A, S, EL, EfficiencyScore) from
 * normalized, window-filtered decision records.
 *
 * <p>Only rows with an agent or actor type count as interactions. No input raises: empty or
 * unlabeled input degrades to F=0, D=0, HCL=0, Tr=1, A=0, S=0, EL=0, EfficiencyScore=1.</p>
 */
public final class InteractionMetricEngine {
    public static final double DEFAULT_RT_MAX_S = 5.0;

    static final double OFFROLE_PENALTY_WEIGHT = 0.35;
    static final double PROGRESS_BONUS_WEIGHT = 0.10;
    static final double ADAPTABILITY_BUCKET_SHARE = 0.2;
    static final double ADAPTABILITY_MIN_DENOMINATOR = 1e-9;

    private static final String ERROR_EVENT = "error";

    private InteractionMetricEngine() {}

    public static InteractionMetrics compute(List<DecisionRecord> records, Double baselineS, double rtMaxS) {
        return compute(records, null, baselineS, rtMaxS);
    }

    /**
     * @param explicitTotalTimeS session length in seconds; derived from the rows when null
     * @param baselineS expected session length for EL; EL=0 unless positive
     * @param rtMaxS response-time SLA used to normalize HCL
     */
    public static InteractionMetrics compute(
            List<DecisionRecord> records, Double explicitTotalTimeS, Double baselineS, double rtMaxS) {
        List<DecisionRecord> sorted = RecordNormalizer.sortedByTime(records);
        List<DecisionRecord> agentRows = agentRows(sorted);
        int n = agentRows.size();
        double totalTime = totalTime(agentRows, explicitTotalTimeS);

        double frequency = totalTime > 0.0 ? n / (totalTime / 60.0) : 0.0;

        List<Double> durations = durations(agentRows);
        double meanDuration = mean(durations);

        double hcl = humanCenteredLatency(agentRows, durations, rtMaxS);
        double trust = trust(sorted, agentRows);
        double adaptability = adaptability(agentRows);
        double similarity = similarity(agentRows);

        double effortLoss = 0.0;
        if (baselineS != null && baselineS > 0.0 && totalTime > 0.0) {
            effortLoss = Math.max(0.0, (totalTime - baselineS) / baselineS);
        }

        double efficiency = 1.0 / (1.0 + effortLoss);
        int offRole = 0;
        for (DecisionRecord row : agentRows) {
            if (JsonNodeUtils.isTruthy(row.field("off_role_action"))) {
                offRole++;
            }
        }
        double offRoleRate = n > 0 ? (double) offRole / n : 0.0;
        int progress = 0;
        for (DecisionRecord row : sorted) {
            if (isProgressEvent(row)) {
                progress++;
            }
        }
        // events per second; sub-second sessions are treated as one second
        double progressRate = totalTime > 0.0 ? progress / Math.max(1.0, totalTime) : 0.0;
        efficiency *= 1.0 - OFFROLE_PENALTY_WEIGHT * clip01(offRoleRate);
        efficiency *= 1.0 + PROGRESS_BONUS_WEIGHT * clip01(progressRate);

        return new InteractionMetrics(
                frequency,
                meanDuration,
                hcl,
                trust,
                adaptability,
                similarity,
                effortLoss,
                clip01(efficiency));
    }

    /**
     * KPI vector per canonical agent, in order of first appearance. Rows without an agent are
     * bucketed under {@code unknown}.
     */
    public static Map<String, InteractionMetrics> computeByAgent(
            List<DecisionRecord> records, Double baselineS, double rtMaxS) {
        Map<String, List<DecisionRecord>> byAgent = new LinkedHashMap<>();
        for (DecisionRecord record : RecordNormalizer.sortedByTime(records)) {
            String key = record.agent == null ? "unknown" : record.agent;
            byAgent.computeIfAbsent(key, ignored -> new ArrayList<>()).add(record);
        }
        Map<String, InteractionMetrics> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<DecisionRecord>> bucket : byAgent.entrySet()) {
            out.put(bucket.getKey(), compute(bucket.getValue(), null, baselineS, rtMaxS));
        }
        return out;
    }

    static List<DecisionRecord> agentRows(List<DecisionRecord> records) {
        List<DecisionRecord> out = new ArrayList<>();
        for (DecisionRecord record : records) {
            if (record.hasAgent()) {
                out.add(record);
            }
        }
        return out;
    }

    /**
     * Explicit value, else the t-span of the rows, else the span of parsed instants, else 0.
     */
    static double totalTime(List<DecisionRecord> rows, Double explicitTotalTimeS) {
        if (explicitTotalTimeS != null) {
            return explicitTotalTimeS;
        }
        if (rows.isEmpty()) {
            return 0.0;
        }
        double minT = Double.POSITIVE_INFINITY;
        double maxT = Double.NEGATIVE_INFINITY;
        Double minInstant = null;
        Double maxInstant = null;
        for (DecisionRecord row : rows) {
            minT = Math.min(minT, row.t);
            maxT = Math.max(maxT, row.t);
            if (row.instant != null) {
                minInstant = minInstant == null ? row.instant : Math.min(minInstant, row.instant);
                maxInstant = maxInstant == null ? row.instant : Math.max(maxInstant, row.instant);
            }
        }
        double span = Math.max(0.0, maxT - minT);
        if (span > 0.0) {
            return span;
        }
        if (minInstant != null) {
            return Math.max(0.0, maxInstant - minInstant);
        }
        return 0.0;
    }

    static List<Double> durations(List<DecisionRecord> rows) {
        List<Double> out = new ArrayList<>();
        for (DecisionRecord row : rows) {
            Double seconds = row.durationSeconds();
            if (seconds != null) {
                out.add(Math.max(0.0, seconds));
            }
        }
        return out;
    }

    /**
     * clip01(1 - mean_rt / rt_max). mean_rt prefers human rows, then all durations, then all
     * latencies; with no timing signal it equals rt_max and HCL is 0.
     */
    static double humanCenteredLatency(List<DecisionRecord> agentRows, List<Double> durations, double rtMaxS) {
        if (rtMaxS <= 0.0) {
            return 0.0;
        }
        List<Double> humanTimes = new ArrayList<>();
        List<Double> latencies = new ArrayList<>();
        for (DecisionRecord row : agentRows) {
            Double seconds = row.durationSeconds();
            if (seconds != null && isHuman(row)) {
                humanTimes.add(seconds);
            }
            Double ms = row.effectiveLatencyMs();
            if (ms != null) {
                latencies.add(ms / 1000.0);
            }
        }
        double meanRt;
        if (!humanTimes.isEmpty()) {
            meanRt = mean(humanTimes);
        } else if (!durations.isEmpty()) {
            meanRt = mean(durations);
        } else if (!latencies.isEmpty()) {
            meanRt = mean(latencies);
        } else {
            meanRt = rtMaxS;
        }
        return clip01(1.0 - meanRt / rtMaxS);
    }

    /**
     * clip01(1 - errors / labeled). Labeled rows are agent rows with a correctness flag plus
     * any row whose action or event type is {@code error}; 1 when nothing is labeled.
     */
    static double trust(List<DecisionRecord> allRows, List<DecisionRecord> agentRows) {
        int labeled = 0;
        int errors = 0;
        for (DecisionRecord row : agentRows) {
            if (row.correct != null) {
                labeled++;
                if (!row.correct) {
                    errors++;
                }
            }
        }
        for (DecisionRecord row : allRows) {
            if (ERROR_EVENT.equalsIgnoreCase(row.eventType) || ERROR_EVENT.equalsIgnoreCase(row.action)) {
                labeled++;
                errors++;
            }
        }
        return clip01(1.0 - (labeled > 0 ? (double) errors / labeled : 0.0));
    }

    /**
     * tanh((acc_late - acc_early) / max(1e-9, acc_early)) over the first and last
     * ceil(20%) agent rows.
     */
    static double adaptability(List<DecisionRecord> agentRows) {
        int n = agentRows.size();
        if (n == 0) {
            return 0.0;
        }
        int k = Math.max(1, (int) Math.ceil(ADAPTABILITY_BUCKET_SHARE * n));
        double accEarly = bucketAccuracy(agentRows.subList(0, k));
        double accLate = bucketAccuracy(agentRows.subList(n - k, n));
        double raw = (accLate - accEarly) / Math.max(ADAPTABILITY_MIN_DENOMINATOR, accEarly);
        return Math.tanh(raw);
    }

    /**
     * Share of correct rows among labeled rows; 1.0 when the bucket has no labels.
     */
    static double bucketAccuracy(List<DecisionRecord> bucket) {
        int labeled = 0;
        int correct = 0;
        for (DecisionRecord row : bucket) {
            if (row.correct == null) {
                continue;
            }
            labeled++;
            if (row.correct) {
                correct++;
            }
        }
        return labeled == 0 ? 1.0 : (double) correct / labeled;
    }

    /**
     * exp(-KL(P_human || P_surrogate)) when both distributions exist, else the exact-match rate of
     * {@code action} vs {@code surrogate_action}, else 0.
     */
    static double similarity(List<DecisionRecord> agentRows) {
        Map<String, Double> human = ProbabilityDistributions.aggregate(agentRows, "probs");
        Map<String, Double> surrogate = ProbabilityDistributions.aggregate(agentRows, "surrogate_probs");
        if (!human.isEmpty() && !surrogate.isEmpty()) {
            return clip01(Math.exp(-ProbabilityDistributions.klDivergence(human, surrogate)));
        }
        int compared = 0;
        int matches = 0;
        for (DecisionRecord row : agentRows) {
            String surrogateAction = JsonNodeUtils.asNullableText(row.field("surrogate_action"));
            String action = JsonNodeUtils.asNullableText(row.field("action"));
            if (surrogateAction == null || action == null) {
                continue;
            }
            compared++;
            if (action.equals(surrogateAction)) {
                matches++;
            }
        }
        return clip01(compared > 0 ? (double) matches / compared : 0.0);
    }

    static boolean isHuman(DecisionRecord row) {
        if ("human".equals(row.actorType)) {
            return true;
        }
        return row.agent != null && row.agent.toUpperCase(Locale.ROOT).startsWith("H");
    }

    private static boolean isProgressEvent(DecisionRecord row) {
        String type = row.eventType != null ? row.eventType : row.action;
        if (type == null) {
            return false;
        }
        String lowered = type.toLowerCase(Locale.ROOT);
        return "checklist_progress".equals(lowered) || "progress".equals(lowered);
    }

    static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    static double clip01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
