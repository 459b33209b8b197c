package com.haic.analytics.outcome;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome catalogue emitted by the {@code full} profile.
 *
 * <p>Ratios with a zero denominator are 0. Fields suffixed {@code Pct} are percentages.</p>
 */
public final class OutcomeMetrics {
    // Performance
    public final ConfusionCounts confusion;
    public final double predictionAccuracy;
    public final double precision;
    public final double recall;
    public final double overallAccuracyPct;
    public final double modelImprovementRate;

    // Efficiency
    public final double meanResponseTimeS;
    public final double teachingEfficiency;
    public final double queryEfficiency;
    public final double resourceUtilizationPct;
    public final double taskCompletionTimeS;
    public final double correctionEfficiency;
    public final double errorReductionRatePct;
    public final double knowledgeRetentionPct;

    // Adaptability and learning
    public final double feedbackImpact;
    public final double adaptabilityScore;
    public final double impactOfCorrections;
    public final double learningEfficiency;
    public final double objectiveFulfillmentRate;

    // Collaboration
    public final double humanAiAgreementRate;
    public final double aiAssistanceRate;
    public final double decisionEffectivenessPct;
    public final double timeToResolutionS;
    public final double humanEffortSavedS;

    // Trust and safety
    public final double highConfidenceAccuracyPct;
    public final double trustScore;
    public final double safetyIncidents;
    public final double systemReliabilityPct;

    // Robustness
    public final double adversarialRobustness;
    public final double domainGeneralization;

    OutcomeMetrics(OutcomeTotals totals) {
        int n = totals.records;
        this.confusion = totals.confusion;
        this.predictionAccuracy = ratio(confusion.tp + confusion.tn, n);
        this.precision = confusion.precision();
        this.recall = confusion.recall();
        this.overallAccuracyPct = 100.0 * ratio(totals.correct, n);
        // Explicit time intervals when logged, else one unit per record.
        double improvementSpan = totals.timeInterval > 0.0 ? totals.timeInterval : Math.max(1, n);
        this.modelImprovementRate = (totals.postAdaptation - totals.preAdaptation) / improvementSpan;

        this.meanResponseTimeS = ratio(totals.responseSeconds, n);
        this.teachingEfficiency = ratio(totals.performanceImprovement, totals.timeSpent);
        this.queryEfficiency = ratio(n, totals.targetHits);
        this.resourceUtilizationPct = 100.0 * ratio(totals.resourcesUsed, totals.totalResources);
        this.taskCompletionTimeS = totals.timeWithoutAi - totals.timeWithAi;
        this.correctionEfficiency = ratio(totals.correctionEffectiveness, totals.correctionTime);
        this.errorReductionRatePct = 100.0 * ratio(totals.errorsBefore - totals.errorsAfter, totals.errorsBefore);
        this.knowledgeRetentionPct = 100.0 * ratio(totals.postRetention, totals.preRetention);

        this.feedbackImpact = totals.postFeedback - totals.preFeedback;
        this.adaptabilityScore = totals.postAdaptation - totals.preAdaptation;
        this.impactOfCorrections = totals.postCorrection - totals.preCorrection;
        this.learningEfficiency = ratio(totals.performanceImprovement, totals.timeSpent);
        this.objectiveFulfillmentRate = ratio(totals.objectivesAchieved, n);

        this.humanAiAgreementRate = ratio(totals.agreements, totals.agreementCompared);
        this.aiAssistanceRate = ratio(totals.aiAssisted, n);
        this.decisionEffectivenessPct = 100.0 * ratio(totals.successfulDecisions, n);
        this.timeToResolutionS = meanResponseTimeS;
        this.humanEffortSavedS = taskCompletionTimeS;

        this.highConfidenceAccuracyPct = 100.0 * ratio(totals.highConfidenceCorrect, totals.highConfidence);
        this.trustScore = 100.0 * ratio(totals.trustRatings, totals.trustScale);
        this.safetyIncidents = totals.safetyIncidents;
        this.systemReliabilityPct = 100.0 * ratio(totals.uptime, totals.totalTime);

        this.adversarialRobustness = ratio(totals.performanceAdversarial, totals.performanceNormal);
        this.domainGeneralization = ratio(totals.performanceAcrossDomains, totals.baselinePerformance);
    }

    public Map<String, Double> toMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("outcome_tp", (double) confusion.tp);
        out.put("outcome_fp", (double) confusion.fp);
        out.put("outcome_tn", (double) confusion.tn);
        out.put("outcome_fn", (double) confusion.fn);
        out.put("outcome_prediction_accuracy", predictionAccuracy);
        out.put("outcome_precision", precision);
        out.put("outcome_recall", recall);
        out.put("outcome_overall_accuracy_pct", overallAccuracyPct);
        out.put("outcome_model_improvement_rate", modelImprovementRate);

        out.put("outcome_mean_response_time_s", meanResponseTimeS);
        out.put("outcome_teaching_efficiency", teachingEfficiency);
        out.put("outcome_query_efficiency", queryEfficiency);
        out.put("outcome_resource_utilization_pct", resourceUtilizationPct);
        out.put("outcome_task_completion_time_s", taskCompletionTimeS);
        out.put("outcome_correction_efficiency", correctionEfficiency);
        out.put("outcome_error_reduction_rate_pct", errorReductionRatePct);
        out.put("outcome_knowledge_retention_pct", knowledgeRetentionPct);

        out.put("outcome_feedback_impact", feedbackImpact);
        out.put("outcome_adaptability_score", adaptabilityScore);
        out.put("outcome_impact_of_corrections", impactOfCorrections);
        out.put("outcome_learning_efficiency", learningEfficiency);
        out.put("outcome_objective_fulfillment_rate", objectiveFulfillmentRate);

        out.put("outcome_human_ai_agreement_rate", humanAiAgreementRate);
        out.put("outcome_ai_assistance_rate", aiAssistanceRate);
        out.put("outcome_decision_effectiveness_pct", decisionEffectivenessPct);
        out.put("outcome_time_to_resolution_s", timeToResolutionS);
        out.put("outcome_human_effort_saved_s", humanEffortSavedS);

        out.put("outcome_high_confidence_accuracy_pct", highConfidenceAccuracyPct);
        out.put("outcome_trust_score", trustScore);
        out.put("outcome_safety_incidents", safetyIncidents);
        out.put("outcome_system_reliability_pct", systemReliabilityPct);

        out.put("outcome_adversarial_robustness", adversarialRobustness);
        out.put("outcome_domain_generalization", domainGeneralization);
        return out;
    }

    private static double ratio(double numerator, double denominator) {
        return denominator > 0.0 ? numerator / denominator : 0.0;
    }
}
