package com.haic.analytics.interaction;

import com.fasterxml.jackson.databind.JsonNode;

import com.haic.analytics.model.DecisionRecord;
import com.haic.analytics.parse.JsonNodeUtils;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Action-probability helpers for the policy-similarity score.
 */
final class ProbabilityDistributions {
    static final double KL_EPSILON = 1e-12;

    private ProbabilityDistributions() {}

    /**
     * Clamps negatives to zero and renormalizes; an all-zero input stays all-zero.
     */
    static Map<String, Double> normalize(Map<String, Double> weights) {
        double total = 0.0;
        for (double value : weights.values()) {
            total += Math.max(0.0, value);
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            out.put(entry.getKey(), total <= 0.0 ? 0.0 : Math.max(0.0, entry.getValue()) / total);
        }
        return out;
    }

    /**
     * Averages the distribution under {@code key} across rows that carry a non-empty object
     * there, then renormalizes. Non-numeric entries are ignored. Empty when no row has one.
     */
    static Map<String, Double> aggregate(List<DecisionRecord> rows, String key) {
        Map<String, Double> accum = new LinkedHashMap<>();
        int count = 0;
        for (DecisionRecord row : rows) {
            JsonNode dist = row.field(key);
            if (!dist.isObject() || dist.size() == 0) {
                continue;
            }
            Map<String, Double> weights = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = dist.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Double value = JsonNodeUtils.asNullableDouble(field.getValue());
                if (value != null) {
                    weights.put(field.getKey(), value);
                }
            }
            if (weights.isEmpty()) {
                continue;
            }
            for (Map.Entry<String, Double> entry : normalize(weights).entrySet()) {
                accum.merge(entry.getKey(), entry.getValue(), Double::sum);
            }
            count++;
        }
        if (count == 0 || accum.isEmpty()) {
            return Collections.emptyMap();
        }
        final int n = count;
        accum.replaceAll((action, sum) -> sum / n);
        return normalize(accum);
    }

    /**
     * KL(P || Q) over the union of actions, with both operands floored at {@link #KL_EPSILON}.
     */
    static double klDivergence(Map<String, Double> p, Map<String, Double> q) {
        Set<String> keys = new LinkedHashSet<>(p.keySet());
        keys.addAll(q.keySet());
        double kl = 0.0;
        for (String key : keys) {
            double pk = Math.max(KL_EPSILON, p.getOrDefault(key, 0.0));
            double qk = Math.max(KL_EPSILON, q.getOrDefault(key, 0.0));
            kl += pk * Math.log(pk / qk);
        }
        return kl;
    }
}
