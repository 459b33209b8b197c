package com.haic.analytics.latency;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import com.haic.analytics.model.DecisionRecord;
import com.haic.analytics.parse.JsonNodeUtils;
import com.haic.analytics.parse.RecordNormalizer;
import com.haic.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Percentiles grouped by a session-level key across a multi-session log root:
 * {@code {logs: [{<group_key>: ..., decisions: [...]}], extras: {rt_limits: {...}}}}.
 */
public final class GroupedPercentiles {
    public static final String DEFAULT_HUMAN_GROUP_KEY = "pilot_tag";
    public static final String DEFAULT_AI_GROUP_KEY = "ai_model_version";
    public static final double DEFAULT_HUMAN_SLA_S = 30.0;
    public static final double DEFAULT_AI_SLA_MS = 5000.0;

    private static final double[] QUANTILES = {PercentileSummary.Q50, PercentileSummary.Q90, PercentileSummary.Q95};

    private GroupedPercentiles() {}

    /**
     * Human response times in seconds; SLA from {@code extras.rt_limits.rt_max_human_s}.
     */
    public static GroupedPercentileReport humanResponseTimesBy(JsonNode logsRoot, String groupKey) {
        double sla = JsonNodeUtils.asDoubleOrDefault(
                rtLimits(logsRoot).path("rt_max_human_s"), DEFAULT_HUMAN_SLA_S);
        return build(logsRoot, groupKey, sla,
                record -> ResponseTimeSummarizer.HUMAN_ACTORS.contains(StringSemantics.lowerOrEmpty(record.actorType)),
                ResponseTimeSummarizer::responseSeconds);
    }

    /**
     * AI latencies in milliseconds; SLA from {@code extras.rt_limits.rt_max_ai_ms}.
     */
    public static GroupedPercentileReport aiLatenciesBy(JsonNode logsRoot, String groupKey) {
        double sla = JsonNodeUtils.asDoubleOrDefault(
                rtLimits(logsRoot).path("rt_max_ai_ms"), DEFAULT_AI_SLA_MS);
        return build(logsRoot, groupKey, sla, ResponseTimeSummarizer::isAi, ResponseTimeSummarizer::latencyMs);
    }

    private static GroupedPercentileReport build(
            JsonNode logsRoot,
            String groupKey,
            double sla,
            Predicate<DecisionRecord> include,
            Function<DecisionRecord, Double> value) {
        Map<String, List<Double>> byGroup = new TreeMap<>();
        JsonNode sessions = logsRoot == null ? null : logsRoot.get("logs");
        if (sessions != null && sessions.isArray()) {
            for (JsonNode session : sessions) {
                String group = StringSemantics.firstNonBlank(
                        JsonNodeUtils.asNullableText(session.get(groupKey)), "unknown");
                List<JsonNode> raw = new ArrayList<>();
                session.path("decisions").forEach(raw::add);
                for (DecisionRecord record : RecordNormalizer.normalize(raw).records) {
                    if (!include.test(record)) {
                        continue;
                    }
                    Double v = value.apply(record);
                    if (v != null) {
                        byGroup.computeIfAbsent(group, ignored -> new ArrayList<>()).add(v);
                    }
                }
            }
        }

        List<String> labels = new ArrayList<>(byGroup.keySet());
        List<String> series = new ArrayList<>();
        List<List<Double>> data = new ArrayList<>();
        for (double q : QUANTILES) {
            series.add("p" + Math.round(q * 100));
            List<Double> row = new ArrayList<>();
            for (String label : labels) {
                row.add(Percentiles.linear(byGroup.get(label), q));
            }
            data.add(row);
        }
        Map<String, Integer> counts = new TreeMap<>();
        byGroup.forEach((group, values) -> counts.put(group, values.size()));
        return new GroupedPercentileReport(labels, series, data, counts, sla, groupKey);
    }

    private static JsonNode rtLimits(JsonNode logsRoot) {
        if (logsRoot == null) {
            return MissingNode.getInstance();
        }
        return logsRoot.path("extras").path("rt_limits");
    }
}
