package com.haic.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;

/**
 * Shared JSON helper methods for reading optional fields with safe defaults.
 *
 * <p>All coercions are total: unparseable input yields null, never an exception.</p>
 */
public final class JsonNodeUtils {
    private JsonNodeUtils() {}

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    /**
     * A value counts as present when it is not null, not an empty string and not an empty
     * array or object.
     */
    public static boolean isPresent(JsonNode node) {
        if (isAbsent(node)) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        if (node.isContainerNode()) {
            return node.size() > 0;
        }
        return true;
    }

    /**
     * Returns the value of the first alias present on {@code record}, or null.
     */
    public static JsonNode firstPresent(JsonNode record, List<String> aliases) {
        if (record == null || !record.isObject()) {
            return null;
        }
        for (String key : aliases) {
            JsonNode value = record.get(key);
            if (isPresent(value)) {
                return value;
            }
        }
        return null;
    }

    public static String asNullableText(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value == null || value.isEmpty() ? null : value;
    }

    public static boolean isNumber(JsonNode node) {
        return node != null && node.isNumber();
    }

    /**
     * Numeric coercion accepting JSON numbers and numeric strings. Booleans and non-finite
     * values are rejected.
     */
    public static Double asNullableDouble(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            return Double.isFinite(value) ? value : null;
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty()) {
                return null;
            }
            try {
                double value = Double.parseDouble(raw);
                return Double.isFinite(value) ? value : null;
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static double asDoubleOrDefault(JsonNode node, double defaultValue) {
        Double value = asNullableDouble(node);
        return value == null ? defaultValue : value;
    }

    /**
     * Boolean coercion for JSON booleans, 0/1 numbers and the usual textual spellings.
     */
    public static Boolean asNullableBoolean(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            double value = node.asDouble();
            if (value == 1.0) {
                return Boolean.TRUE;
            }
            if (value == 0.0) {
                return Boolean.FALSE;
            }
            return null;
        }
        if (node.isTextual()) {
            switch (node.asText().trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "t":
                case "yes":
                case "y":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "f":
                case "no":
                case "n":
                case "0":
                    return Boolean.FALSE;
                default:
                    return null;
            }
        }
        return null;
    }

    /**
     * Loose truthiness: present booleans, non-zero numbers and non-empty values are true.
     */
    public static boolean isTruthy(JsonNode node) {
        if (!isPresent(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.asDouble() != 0.0;
        }
        return true;
    }
}
