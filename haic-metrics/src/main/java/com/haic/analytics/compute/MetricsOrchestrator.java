package com.haic.analytics.compute;

import com.fasterxml.jackson.databind.JsonNode;

import com.haic.analytics.config.MetricsOptions;
import com.haic.analytics.config.Profile;
import com.haic.analytics.error.InputShapeException;
import com.haic.analytics.interaction.InteractionMetricEngine;
import com.haic.analytics.interaction.InteractionMetrics;
import com.haic.analytics.latency.PercentileSummary;
import com.haic.analytics.latency.ResponseTimeSummarizer;
import com.haic.analytics.outcome.OutcomeMetricEngine;
import com.haic.analytics.outcome.OutcomeMetrics;
import com.haic.analytics.outcome.OutcomeVocabularyLoader;
import com.haic.analytics.parse.RecordNormalizer;
import com.haic.analytics.quality.DecisionInputValidator;
import com.haic.analytics.util.JsonSupport;
import com.haic.analytics.window.RecordFilter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point for metric computation over a decisions artifact or a bare decisions list.
 *
 * <p>Pipeline: validate, normalize, window, then the interaction, response-time, latency and
 * (for {@link Profile#FULL}) outcome engines. The orchestrator holds no per-call state, so one
 * instance can serve concurrent callers.</p>
 */
public final class MetricsOrchestrator {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(MetricsOrchestrator.class);

    private final DecisionInputValidator validator;
    private final OutcomeMetricEngine outcomeEngine;

    public MetricsOrchestrator() {
        this(new DecisionInputValidator(), null);
    }

    /**
     * @param outcomeEngine engine for the full profile; the default vocabulary is loaded lazily when null
     */
    public MetricsOrchestrator(DecisionInputValidator validator, OutcomeMetricEngine outcomeEngine) {
        this.validator = validator;
        this.outcomeEngine = outcomeEngine;
    }

    public MetricsResult computeMetrics(Object input) {
        return computeMetrics(input, MetricsOptions.defaults());
    }

    /**
     * @param input a {@link JsonNode}, or any value Jackson can map to one (a {@code List} of
     *              records, a {@code Map} artifact)
     */
    public MetricsResult computeMetrics(Object input, MetricsOptions options) {
        JsonNode root = JsonSupport.toTree(input);
        JsonNode artifact = root != null && root.isObject() ? root : null;
        JsonNode decisions = extractDecisions(root);

        DecisionInputValidator.ValidationResult validation = validator.validate(decisions);
        if (!validation.valid) {
            throw new InputShapeException(validation.reason, "Invalid decisions input: " + validation.details);
        }

        List<JsonNode> rawRecords = new ArrayList<>(decisions.size());
        decisions.forEach(rawRecords::add);
        RecordNormalizer.Result normalized = RecordNormalizer.normalize(rawRecords);
        RecordFilter.Result filtered = RecordFilter.apply(artifact, normalized.records, options.window);

        InteractionMetrics interaction =
                InteractionMetricEngine.compute(filtered.decisions, options.baselineS, options.rtMaxS);
        PercentileSummary humanRt = ResponseTimeSummarizer.humanResponseTimes(filtered.decisions);
        PercentileSummary aiLatency = ResponseTimeSummarizer.aiLatencies(filtered.decisions);
        OutcomeMetrics outcome = options.profile == Profile.FULL
                ? outcomeEngine().compute(filtered.decisions)
                : null;

        List<String> warnings = null;
        if (options.includeWarnings) {
            warnings = new ArrayList<>(validation.warnings);
            warnings.addAll(normalized.notes);
        }
        MetricsResult result = new MetricsResult(interaction, humanRt, aiLatency, outcome, filtered.summary, warnings);
        LOG.debug("Computed {} metrics over {}/{} decisions (profile={})",
                result.metrics.size(), filtered.decisions.size(), normalized.records.size(),
                options.profile.wireName());
        return result;
    }

    /**
     * Interaction metrics per canonical agent, after normalization and windowing.
     */
    public Map<String, InteractionMetrics> computeByAgent(Object input, MetricsOptions options) {
        JsonNode root = JsonSupport.toTree(input);
        JsonNode decisions = extractDecisions(root);
        if (!decisions.isArray()) {
            throw new InputShapeException("decisions_not_list", "'decisions' must be a list");
        }
        List<JsonNode> rawRecords = new ArrayList<>(decisions.size());
        decisions.forEach(rawRecords::add);
        RecordNormalizer.Result normalized = RecordNormalizer.normalize(rawRecords);
        RecordFilter.Result filtered =
                RecordFilter.apply(root.isObject() ? root : null, normalized.records, options.window);
        return InteractionMetricEngine.computeByAgent(filtered.decisions, options.baselineS, options.rtMaxS);
    }

    /**
     * Computes independent sessions in parallel. Results keep the order of {@code inputs}; the
     * first failure propagates.
     */
    public List<MetricsResult> computeAll(List<?> inputs, MetricsOptions options) {
        return inputs.parallelStream()
                .map(input -> computeMetrics(input, options))
                .collect(Collectors.toList());
    }

    static JsonNode extractDecisions(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new InputShapeException("decisions_not_list", "Input must be a decisions list or an artifact object");
        }
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            JsonNode decisions = root.get("decisions");
            if (decisions == null || decisions.isNull()) {
                throw new InputShapeException("missing_decisions", "Artifact object has no 'decisions' field");
            }
            return decisions;
        }
        throw new InputShapeException("decisions_not_list", "Input must be a decisions list or an artifact object");
    }

    private OutcomeMetricEngine outcomeEngine() {
        return outcomeEngine != null ? outcomeEngine : new OutcomeMetricEngine(OutcomeVocabularyLoader.loadDefault());
    }
}
