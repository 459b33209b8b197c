package com.haic.analytics.outcome;

import com.fasterxml.jackson.databind.JsonNode;

import com.haic.analytics.model.DecisionRecord;
import com.haic.analytics.parse.JsonNodeUtils;
import com.haic.analytics.util.StringSemantics;

import java.util.List;

/**
 * Derives confusion contributions and correctness from heterogeneous label schemes and
 * aggregates them into the outcome catalogue.
 *
 * <p>Confusion precedence per record:
 * 1) explicit result label ({@code true_positive}, {@code tp}, ...);
 * 2) (prediction, ground_truth) classified through the {@link OutcomeVocabulary};
 * 3) no contribution.
 * </p>
 *
 * <p>Correctness precedence: boolean flag, then a correctness string, then the confusion
 * contribution (correct when TP or TN).</p>
 */
public final class OutcomeMetricEngine {
    static final double HIGH_CONFIDENCE_THRESHOLD = 0.9;

    private final OutcomeVocabulary vocabulary;

    public OutcomeMetricEngine(OutcomeVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public static OutcomeMetricEngine withDefaultVocabulary() {
        return new OutcomeMetricEngine(OutcomeVocabularyLoader.loadDefault());
    }

    public OutcomeMetrics compute(List<DecisionRecord> records) {
        OutcomeTotals totals = new OutcomeTotals();
        for (DecisionRecord record : records) {
            totals.records++;
            ConfusionCounts contribution = confusion(record);
            totals.confusion = totals.confusion.plus(contribution);

            boolean isCorrect = isCorrect(record, contribution);
            if (isCorrect) {
                totals.correct++;
            }

            String truth = JsonNodeUtils.asNullableText(JsonNodeUtils.firstPresent(record.payload, OutcomeFields.GROUND_TRUTH));
            String predicted = JsonNodeUtils.asNullableText(JsonNodeUtils.firstPresent(record.payload, OutcomeFields.PREDICTION));
            if (truth != null || predicted != null) {
                totals.agreementCompared++;
                if (truth != null && predicted != null
                        && StringSemantics.lowerOrEmpty(truth).equals(StringSemantics.lowerOrEmpty(predicted))) {
                    totals.agreements++;
                }
            }

            if (OutcomeTotals.amount(record.payload, OutcomeFields.CONFIDENCE) >= HIGH_CONFIDENCE_THRESHOLD) {
                totals.highConfidence++;
                if (isCorrect) {
                    totals.highConfidenceCorrect++;
                }
            }
            totals.responseSeconds += responseSeconds(record);
            totals.addMeasures(record.payload);
        }
        return new OutcomeMetrics(totals);
    }

    public ConfusionCounts confusion(DecisionRecord record) {
        JsonNode resultLabel = JsonNodeUtils.firstPresent(record.payload, OutcomeFields.RESULT_LABEL);
        ConfusionCounts explicit = ConfusionCounts.fromResultLabel(JsonNodeUtils.asNullableText(resultLabel));
        if (explicit != null) {
            return explicit;
        }
        Boolean predicted = vocabulary.classify(JsonNodeUtils.firstPresent(record.payload, OutcomeFields.PREDICTION));
        Boolean actual = vocabulary.classify(JsonNodeUtils.firstPresent(record.payload, OutcomeFields.GROUND_TRUTH));
        if (predicted == null || actual == null) {
            return ConfusionCounts.NONE;
        }
        return ConfusionCounts.fromPair(predicted, actual);
    }

    public boolean isCorrect(DecisionRecord record) {
        return isCorrect(record, confusion(record));
    }

    private boolean isCorrect(DecisionRecord record, ConfusionCounts contribution) {
        Boolean flag = JsonNodeUtils.asNullableBoolean(JsonNodeUtils.firstPresent(record.payload, OutcomeFields.OUTCOME_BOOL));
        if (flag != null) {
            return flag;
        }
        Boolean token = vocabulary.correctness(JsonNodeUtils.firstPresent(record.payload, OutcomeFields.RESULT_CORRECT_STR));
        if (token != null) {
            return token;
        }
        return contribution.isCorrect();
    }

    /**
     * Response-time aliases in seconds, else latency aliases in milliseconds, else 0.
     */
    private static double responseSeconds(DecisionRecord record) {
        Double seconds = JsonNodeUtils.asNullableDouble(JsonNodeUtils.firstPresent(record.payload, OutcomeFields.RESPONSE_TIME_S));
        if (seconds != null) {
            return seconds;
        }
        Double ms = JsonNodeUtils.asNullableDouble(JsonNodeUtils.firstPresent(record.payload, OutcomeFields.LATENCY_MS));
        return ms == null ? 0.0 : ms / 1000.0;
    }
}
