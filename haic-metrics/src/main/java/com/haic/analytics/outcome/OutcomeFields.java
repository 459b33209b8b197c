package com.haic.analytics.outcome;

import java.util.Arrays;
import java.util.List;

/**
 * Alias lists for outcome-related record fields, first present alias wins.
 */
final class OutcomeFields {
    static final List<String> RESULT_LABEL = Arrays.asList("ai_detection_results", "result", "outcome_label");
    static final List<String> PREDICTION = Arrays.asList(
            "prediction", "predicted", "pred_label", "ai_label", "ai_decision", "ai_suggestion");
    static final List<String> GROUND_TRUTH = Arrays.asList(
            "ground_truth", "true_label", "label", "human_label", "human_decision", "op_decision");
    static final List<String> OUTCOME_BOOL = Arrays.asList("correct", "is_correct", "agreement");
    static final List<String> RESULT_CORRECT_STR = Arrays.asList("result", "outcome");
    static final List<String> RESPONSE_TIME_S = Arrays.asList(
            "response_time", "time_to_response", "resolution_time", "duration_s", "handle_time_s");
    static final List<String> LATENCY_MS = Arrays.asList("latency_ms", "inference_ms", "latency");
    static final List<String> CONFIDENCE = Arrays.asList("confidence_level", "confidence");
    static final List<String> TRUST_RATING = Arrays.asList("trust_rating");
    static final List<String> TRUST_SCALE_MAXIMUM = Arrays.asList("trust_scale_maximum");
    static final List<String> SAFETY_INCIDENTS = Arrays.asList("safety_incidents");

    // Times and resources.
    static final List<String> TIME_WITH_AI = Arrays.asList("time_with_ai");
    static final List<String> TIME_WITHOUT_AI = Arrays.asList("time_without_ai");
    static final List<String> TIME_INTERVAL = Arrays.asList("time_interval");
    static final List<String> CORRECTION_TIME = Arrays.asList("correction_time", "time_spent_correcting");
    static final List<String> TIME_SPENT = Arrays.asList("time_spent", "learning_time", "total_time");
    static final List<String> PERFORMANCE_IMPROVEMENT = Arrays.asList("performance_improvement", "learning_gain");
    static final List<String> RESOURCES_USED = Arrays.asList("resources_used", "cpu_used", "gpu_used", "mem_used");
    static final List<String> TOTAL_RESOURCES = Arrays.asList("total_resources", "cpu_total", "gpu_total", "mem_total");

    // Before/after measurements.
    static final List<String> REACHED_TARGET = Arrays.asList("reached_target", "meets_target", "target_reached");
    static final List<String> CORRECTION_EFFECTIVENESS = Arrays.asList("correction_effectiveness");
    static final List<String> ERRORS_BEFORE = Arrays.asList("errors_before");
    static final List<String> ERRORS_AFTER = Arrays.asList("errors_after");
    static final List<String> PRE_RETENTION = Arrays.asList("pre_retention_performance");
    static final List<String> POST_RETENTION = Arrays.asList("post_retention_performance");
    static final List<String> PRE_FEEDBACK = Arrays.asList("pre_feedback_performance");
    static final List<String> POST_FEEDBACK = Arrays.asList("post_feedback_performance");
    static final List<String> PRE_ADAPTATION = Arrays.asList("pre_adaptation_performance");
    static final List<String> POST_ADAPTATION = Arrays.asList("post_adaptation_performance");
    static final List<String> PRE_CORRECTION = Arrays.asList("pre_correction_performance");
    static final List<String> POST_CORRECTION = Arrays.asList("post_correction_performance");

    // Collaboration flags and statuses.
    static final List<String> AI_ASSISTED = Arrays.asList("ai_assisted", "assisted", "ai_help");
    static final List<String> OBJECTIVE_STATUS = Arrays.asList("objective_status");
    static final List<String> DECISION_OUTCOME = Arrays.asList("decision_outcome");

    // Reliability and robustness.
    static final List<String> UPTIME = Arrays.asList("uptime");
    static final List<String> TOTAL_TIME = Arrays.asList("total_time");
    static final List<String> PERFORMANCE_ADVERSARIAL = Arrays.asList("performance_adversarial");
    static final List<String> PERFORMANCE_NORMAL = Arrays.asList("performance_normal");
    static final List<String> PERFORMANCE_ACROSS_DOMAINS = Arrays.asList("performance_across_domains");
    static final List<String> BASELINE_PERFORMANCE = Arrays.asList("baseline_performance");

    private OutcomeFields() {}
}
