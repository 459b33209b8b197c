package com.haic.analytics.outcome;

import com.fasterxml.jackson.databind.JsonNode;

import com.haic.analytics.parse.JsonNodeUtils;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Label vocabulary for confusion inference and correctness strings, loaded from a versioned
 * catalog. Entries are matched case-insensitively after trimming.
 *
 * <p>The shipped catalog leans on radiology/manufacturing terms; other domains should supply
 * their own via {@link OutcomeVocabularyLoader}.</p>
 */
public final class OutcomeVocabulary {
    private final String version;
    private final Set<String> positive;
    private final Set<String> negative;
    private final Set<String> correctTokens;
    private final Set<String> incorrectTokens;

    public OutcomeVocabulary(String version, Set<String> positive, Set<String> negative,
            Set<String> correctTokens, Set<String> incorrectTokens) {
        this.version = version == null || version.isBlank() ? "unknown" : version;
        this.positive = lowered(positive);
        this.negative = lowered(negative);
        this.correctTokens = lowered(correctTokens);
        this.incorrectTokens = lowered(incorrectTokens);
    }

    public String version() {
        return version;
    }

    /**
     * True for a positive label, false for a negative one, null when neither the vocabulary
     * nor the numeric/boolean fallbacks recognize it.
     */
    public Boolean classify(JsonNode label) {
        String s = labelText(label);
        if (s == null) {
            return null;
        }
        if (positive.contains(s)) {
            return Boolean.TRUE;
        }
        if (negative.contains(s)) {
            return Boolean.FALSE;
        }
        Double numeric = JsonNodeUtils.asNullableDouble(label);
        if (numeric != null) {
            return numeric != 0.0;
        }
        return JsonNodeUtils.asNullableBoolean(label);
    }

    /**
     * True/false for recognized correctness strings such as {@code correct}/{@code incorrect};
     * null otherwise.
     */
    public Boolean correctness(JsonNode value) {
        String s = labelText(value);
        if (s == null) {
            return null;
        }
        if (correctTokens.contains(s)) {
            return Boolean.TRUE;
        }
        if (incorrectTokens.contains(s)) {
            return Boolean.FALSE;
        }
        return null;
    }

    static String labelText(JsonNode label) {
        if (!JsonNodeUtils.isPresent(label) || label.isContainerNode()) {
            return null;
        }
        if (label.isBoolean()) {
            return String.valueOf(label.booleanValue());
        }
        return label.asText().trim().toLowerCase(Locale.ROOT);
    }

    private static Set<String> lowered(Set<String> values) {
        Set<String> out = new HashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null) {
                    out.add(value.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return Collections.unmodifiableSet(out);
    }
}
