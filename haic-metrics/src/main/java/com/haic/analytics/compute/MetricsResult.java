package com.haic.analytics.compute;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import com.haic.analytics.interaction.InteractionMetrics;
import com.haic.analytics.latency.PercentileSummary;
import com.haic.analytics.model.WindowSummary;
import com.haic.analytics.outcome.OutcomeMetrics;
import com.haic.analytics.util.JsonSupport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.haic.analytics.latency.ResponseTimeSummarizer.AI_LATENCY_PREFIX;
import static com.haic.analytics.latency.ResponseTimeSummarizer.HUMAN_RT_PREFIX;

/**
 * Output of one metrics computation: the flat metric map, the window summary and, unless
 * disabled, the accumulated warnings.
 */
@JsonPropertyOrder({"ok", "metrics", "window_summary", "warnings"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MetricsResult {
    @JsonProperty("ok")
    public final boolean ok;
    @JsonProperty("metrics")
    public final Map<String, Double> metrics;
    @JsonProperty("window_summary")
    public final WindowSummary windowSummary;
    /** Null when warnings were not requested. */
    @JsonProperty("warnings")
    public final List<String> warnings;

    @JsonIgnore
    public final InteractionMetrics interaction;
    @JsonIgnore
    public final PercentileSummary humanResponseTimes;
    @JsonIgnore
    public final PercentileSummary aiLatencies;
    /** Null unless the full profile was requested. */
    @JsonIgnore
    public final OutcomeMetrics outcome;

    MetricsResult(
            InteractionMetrics interaction,
            PercentileSummary humanResponseTimes,
            PercentileSummary aiLatencies,
            OutcomeMetrics outcome,
            WindowSummary windowSummary,
            List<String> warnings) {
        this.ok = true;
        this.interaction = interaction;
        this.humanResponseTimes = humanResponseTimes;
        this.aiLatencies = aiLatencies;
        this.outcome = outcome;
        this.metrics = Collections.unmodifiableMap(flatten(interaction, humanResponseTimes, aiLatencies, outcome));
        this.windowSummary = windowSummary;
        this.warnings = warnings == null ? null : List.copyOf(warnings);
    }

    private static Map<String, Double> flatten(
            InteractionMetrics interaction,
            PercentileSummary humanResponseTimes,
            PercentileSummary aiLatencies,
            OutcomeMetrics outcome) {
        Map<String, Double> out = new LinkedHashMap<>(interaction.toMap());
        out.putAll(humanResponseTimes.toMap(HUMAN_RT_PREFIX, "s"));
        out.putAll(aiLatencies.toMap(AI_LATENCY_PREFIX, "ms"));
        if (outcome != null) {
            out.putAll(outcome.toMap());
        }
        return out;
    }

    /**
     * Metric value by key, or null when the key is not part of the computed catalogue.
     */
    public Double metric(String key) {
        return metrics.get(key);
    }

    public String toJson() {
        return JsonSupport.toJson(this);
    }

    @Override
    public String toString() {
        return "MetricsResult{metrics=" + metrics + ", warnings=" + warnings + "}";
    }
}
