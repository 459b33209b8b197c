package com.haic.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.haic.analytics.parse.JsonNodeUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Advisory validator for a decisions list. Only the top-level container shape is a hard failure;
 * everything else becomes a warning so the computation can degrade gracefully.
 */
public class DecisionInputValidator {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(DecisionInputValidator.class);

    public static final String EMPTY_DECISIONS_WARNING = "decisions list is empty";
    static final int SAMPLE_SIZE = 10;
    static final List<String> TIME_KEYS = Arrays.asList("timestamp", "ts", "t", "time");
    static final List<String> TYPE_KEYS = Arrays.asList("event_type", "action", "type");

    public ValidationResult validate(JsonNode decisions) {
        if (decisions == null || !decisions.isArray()) {
            LOG.debug("Decision validation failed: decisions is not a list");
            return ValidationResult.invalid("decisions_not_list", "'decisions' must be a list");
        }
        List<String> warnings = new ArrayList<>();
        if (decisions.size() == 0) {
            warnings.add(EMPTY_DECISIONS_WARNING);
            return ValidationResult.valid(warnings);
        }

        int sampled = Math.min(SAMPLE_SIZE, decisions.size());
        for (int i = 0; i < sampled; i++) {
            JsonNode record = decisions.get(i);
            if (record == null || !record.isObject()) {
                warnings.add("decision[" + i + "] is not an object");
                continue;
            }
            if (!hasAny(record, TIME_KEYS)) {
                warnings.add("decision[" + i + "] missing time key (timestamp|ts|t|time)");
            }
            if (!hasAny(record, TYPE_KEYS)) {
                warnings.add("decision[" + i + "] missing type key (event_type|action|type)");
            }
        }
        for (int i = sampled; i < decisions.size(); i++) {
            if (!decisions.get(i).isObject()) {
                warnings.add("decision[" + i + "] is not an object");
            }
        }
        if (!warnings.isEmpty()) {
            LOG.debug("Decision validation produced {} warnings", warnings.size());
        }
        return ValidationResult.valid(warnings);
    }

    private static boolean hasAny(JsonNode record, List<String> keys) {
        for (String key : keys) {
            if (JsonNodeUtils.isPresent(record.get(key))) {
                return true;
            }
        }
        return false;
    }

    public static class ValidationResult {
        public final boolean valid;
        public final String reason;
        public final String details;
        public final List<String> warnings;

        private ValidationResult(boolean valid, String reason, String details, List<String> warnings) {
            this.valid = valid;
            this.reason = reason;
            this.details = details;
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public static ValidationResult valid(List<String> warnings) {
            return new ValidationResult(true, null, null, new ArrayList<>(warnings));
        }

        public static ValidationResult invalid(String reason, String details) {
            return new ValidationResult(false, reason, details, new ArrayList<>());
        }
    }
}
