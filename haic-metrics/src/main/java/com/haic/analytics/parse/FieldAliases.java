package com.haic.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered alias lists per canonical decision field. The first present alias wins.
 */
public final class FieldAliases {
    public static final String AGENT = "agent";
    public static final String TIMESTAMP = "timestamp";
    public static final String ACTION = "action";
    public static final String DURATION_S = "duration_s";
    public static final String LATENCY_MS = "latency_ms";
    public static final String CORRECT = "correct";

    public static final String BARE_LATENCY = "latency";

    private static final Map<String, List<String>> ALIASES = buildAliases();

    private FieldAliases() {}

    public static List<String> aliasesFor(String canonicalField) {
        List<String> aliases = ALIASES.get(canonicalField);
        if (aliases == null) {
            throw new IllegalArgumentException("No alias table for field: " + canonicalField);
        }
        return aliases;
    }

    public static JsonNode lookup(JsonNode record, String canonicalField) {
        return JsonNodeUtils.firstPresent(record, aliasesFor(canonicalField));
    }

    private static Map<String, List<String>> buildAliases() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put(AGENT, Arrays.asList("agent", "actor_type", "actor", "role"));
        map.put(TIMESTAMP, Arrays.asList("timestamp", "time", "created_at", "event_time", "date"));
        map.put(ACTION, Arrays.asList("action", "event_type", "type", "name"));
        map.put(DURATION_S, Arrays.asList("duration_s", "human_duration_s", "duration"));
        map.put(LATENCY_MS, Arrays.asList("latency_ms", "inference_ms"));
        map.put(CORRECT, Arrays.asList("correct", "is_correct", "agreement"));
        return Collections.unmodifiableMap(map);
    }
}
