package com.haic.analytics.latency;

import com.haic.analytics.model.DecisionRecord;
import com.haic.analytics.model.TimingSignals;
import com.haic.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Percentile summaries for human response times (seconds) and AI latencies (milliseconds).
 */
public final class ResponseTimeSummarizer {
    public static final String HUMAN_RT_PREFIX = "human_rt";
    public static final String AI_LATENCY_PREFIX = "ai_latency";

    public static final Set<String> HUMAN_ACTORS =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("human", "operator", "radiologist")));
    public static final Set<String> AI_ACTORS =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("ai", "model")));
    public static final Set<String> AI_ACTIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "ai_evaluated", "classify", "forecast", "ai_inference", "ai_decision")));

    private ResponseTimeSummarizer() {}

    public static PercentileSummary humanResponseTimes(List<DecisionRecord> records) {
        List<Double> seconds = new ArrayList<>();
        for (DecisionRecord record : records) {
            if (!isHumanOrUnset(record)) {
                continue;
            }
            Double rt = responseSeconds(record);
            if (rt != null) {
                seconds.add(rt);
            }
        }
        return PercentileSummary.of(seconds);
    }

    public static PercentileSummary aiLatencies(List<DecisionRecord> records) {
        List<Double> millis = new ArrayList<>();
        for (DecisionRecord record : records) {
            if (!isAi(record)) {
                continue;
            }
            Double ms = latencyMs(record);
            if (ms != null) {
                millis.add(ms);
            }
        }
        return PercentileSummary.of(millis);
    }

    /**
     * Permissive: rows with no actor label count as human.
     */
    static boolean isHumanOrUnset(DecisionRecord record) {
        String actor = actorLabel(record);
        return actor.isEmpty() || HUMAN_ACTORS.contains(actor);
    }

    static boolean isAi(DecisionRecord record) {
        String action = StringSemantics.lowerOrEmpty(record.action);
        return AI_ACTORS.contains(actorLabel(record)) || AI_ACTIONS.contains(action);
    }

    /**
     * {@code duration_s}, else {@code latency_ms / 1000}.
     */
    static Double responseSeconds(DecisionRecord record) {
        if (record.durationS != null) {
            return record.durationS;
        }
        return TimingSignals.msToSeconds(record.latencyMs);
    }

    /**
     * {@code latency_ms}, else {@code duration_s * 1000}, else the bare-latency heuristic.
     */
    static Double latencyMs(DecisionRecord record) {
        if (record.latencyMs != null) {
            return record.latencyMs;
        }
        if (record.durationS != null) {
            return TimingSignals.secondsToMs(record.durationS);
        }
        return TimingSignals.bareLatencyToMs(record.rawLatency);
    }

    private static String actorLabel(DecisionRecord record) {
        return StringSemantics.lowerOrEmpty(StringSemantics.firstNonBlank(record.actorType, record.agent));
    }
}
