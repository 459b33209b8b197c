package com.haic.analytics.outcome;

import com.fasterxml.jackson.databind.JsonNode;

import com.haic.analytics.parse.JsonNodeUtils;
import com.haic.analytics.util.StringSemantics;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Running sums behind the outcome catalogue. Ratios are derived once in {@link OutcomeMetrics}.
 */
final class OutcomeTotals {
    private static final Set<String> ACHIEVED_OBJECTIVES = new HashSet<>(Arrays.asList("achieved", "done", "met"));
    private static final Set<String> SUCCESSFUL_DECISIONS = new HashSet<>(Arrays.asList("successful", "success", "ok"));

    int records;
    ConfusionCounts confusion = ConfusionCounts.NONE;
    int correct;
    int agreementCompared;
    int agreements;
    int highConfidence;
    int highConfidenceCorrect;
    double responseSeconds;

    double trustRatings;
    double trustScale;
    double safetyIncidents;
    double uptime;
    double totalTime;

    double timeWithAi;
    double timeWithoutAi;
    double timeInterval;
    double correctionTime;
    double timeSpent;
    double performanceImprovement;
    double resourcesUsed;
    double totalResources;

    int targetHits;
    double correctionEffectiveness;
    double errorsBefore;
    double errorsAfter;
    double preRetention;
    double postRetention;
    double preFeedback;
    double postFeedback;
    double preAdaptation;
    double postAdaptation;
    double preCorrection;
    double postCorrection;

    int aiAssisted;
    int objectivesAchieved;
    int successfulDecisions;

    double performanceAdversarial;
    double performanceNormal;
    double performanceAcrossDomains;
    double baselinePerformance;

    /**
     * Adds the plain numeric and flag fields of one record; label-derived counts are added by the engine.
     */
    void addMeasures(JsonNode payload) {
        trustRatings += amount(payload, OutcomeFields.TRUST_RATING);
        trustScale += amount(payload, OutcomeFields.TRUST_SCALE_MAXIMUM);
        safetyIncidents += amount(payload, OutcomeFields.SAFETY_INCIDENTS);
        uptime += amount(payload, OutcomeFields.UPTIME);
        totalTime += amount(payload, OutcomeFields.TOTAL_TIME);

        timeWithAi += amount(payload, OutcomeFields.TIME_WITH_AI);
        timeWithoutAi += amount(payload, OutcomeFields.TIME_WITHOUT_AI);
        timeInterval += amount(payload, OutcomeFields.TIME_INTERVAL);
        correctionTime += amount(payload, OutcomeFields.CORRECTION_TIME);
        timeSpent += amount(payload, OutcomeFields.TIME_SPENT);
        performanceImprovement += amount(payload, OutcomeFields.PERFORMANCE_IMPROVEMENT);
        resourcesUsed += amount(payload, OutcomeFields.RESOURCES_USED);
        totalResources += amount(payload, OutcomeFields.TOTAL_RESOURCES);

        if (flag(JsonNodeUtils.firstPresent(payload, OutcomeFields.REACHED_TARGET))) {
            targetHits++;
        }
        correctionEffectiveness += amount(payload, OutcomeFields.CORRECTION_EFFECTIVENESS);
        errorsBefore += amount(payload, OutcomeFields.ERRORS_BEFORE);
        errorsAfter += amount(payload, OutcomeFields.ERRORS_AFTER);
        preRetention += amount(payload, OutcomeFields.PRE_RETENTION);
        postRetention += amount(payload, OutcomeFields.POST_RETENTION);
        preFeedback += amount(payload, OutcomeFields.PRE_FEEDBACK);
        postFeedback += amount(payload, OutcomeFields.POST_FEEDBACK);
        preAdaptation += amount(payload, OutcomeFields.PRE_ADAPTATION);
        postAdaptation += amount(payload, OutcomeFields.POST_ADAPTATION);
        preCorrection += amount(payload, OutcomeFields.PRE_CORRECTION);
        postCorrection += amount(payload, OutcomeFields.POST_CORRECTION);

        if (anyFlag(payload, OutcomeFields.AI_ASSISTED)) {
            aiAssisted++;
        }
        if (objectiveAchieved(payload)) {
            objectivesAchieved++;
        }
        if (SUCCESSFUL_DECISIONS.contains(token(JsonNodeUtils.firstPresent(payload, OutcomeFields.DECISION_OUTCOME)))) {
            successfulDecisions++;
        }

        performanceAdversarial += amount(payload, OutcomeFields.PERFORMANCE_ADVERSARIAL);
        performanceNormal += amount(payload, OutcomeFields.PERFORMANCE_NORMAL);
        performanceAcrossDomains += amount(payload, OutcomeFields.PERFORMANCE_ACROSS_DOMAINS);
        baselinePerformance += amount(payload, OutcomeFields.BASELINE_PERFORMANCE);
    }

    private static boolean objectiveAchieved(JsonNode payload) {
        if (ACHIEVED_OBJECTIVES.contains(token(JsonNodeUtils.firstPresent(payload, OutcomeFields.GROUND_TRUTH)))) {
            return true;
        }
        return "achieved".equals(token(JsonNodeUtils.firstPresent(payload, OutcomeFields.OBJECTIVE_STATUS)));
    }

    /**
     * Numeric value of the first present alias; booleans count as 1 or 0, anything else as 0.
     */
    static double amount(JsonNode payload, List<String> aliases) {
        JsonNode value = JsonNodeUtils.firstPresent(payload, aliases);
        if (value != null && value.isBoolean()) {
            return value.booleanValue() ? 1.0 : 0.0;
        }
        return JsonNodeUtils.asDoubleOrDefault(value, 0.0);
    }

    // Recognized boolean spellings first, then loose truthiness.
    private static boolean flag(JsonNode value) {
        Boolean parsed = JsonNodeUtils.asNullableBoolean(value);
        return parsed != null ? parsed : JsonNodeUtils.isTruthy(value);
    }

    private static boolean anyFlag(JsonNode payload, List<String> aliases) {
        for (String alias : aliases) {
            if (payload != null && flag(payload.get(alias))) {
                return true;
            }
        }
        return false;
    }

    private static String token(JsonNode value) {
        return StringSemantics.lowerOrEmpty(JsonNodeUtils.asNullableText(value));
    }
}
