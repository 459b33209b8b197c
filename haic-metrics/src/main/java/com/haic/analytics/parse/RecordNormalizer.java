package com.haic.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.haic.analytics.model.DecisionRecord;
import com.haic.analytics.time.TimeParser;
import com.haic.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps heterogeneous decision records onto {@link DecisionRecord}.
 *
 * <p>Two passes per call:
 * 1) resolve aliases and parse timestamps into instants;
 * 2) fill missing {@code t} as {@code max(0, instant - min(instants))}, else from a counter
 *    starting at 0 that is scoped to this call.
 * </p>
 *
 * <p>Counter-derived {@code t} values only preserve input order. They say nothing about the
 * real time between records and are flagged with {@link DecisionRecord#syntheticTime}.</p>
 */
public final class RecordNormalizer {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(RecordNormalizer.class);

    private static final Map<String, String> AGENT_MAP = buildAgentMap();

    private RecordNormalizer() {}

    public static Result normalize(List<? extends JsonNode> rawRecords) {
        List<String> notes = new ArrayList<>();
        if (rawRecords == null || rawRecords.isEmpty()) {
            return new Result(Collections.emptyList(), notes, 0);
        }

        List<DecisionRecord> rows = new ArrayList<>(rawRecords.size());
        int skipped = 0;
        Double sessionReference = null;
        for (int i = 0; i < rawRecords.size(); i++) {
            JsonNode raw = rawRecords.get(i);
            if (raw == null || !raw.isObject()) {
                LOG.debug("Skipping decision[{}]: not a JSON object", i);
                skipped++;
                continue;
            }
            DecisionRecord row = resolveFields((ObjectNode) raw, i, notes);
            if (row.instant != null) {
                sessionReference = sessionReference == null ? row.instant : Math.min(sessionReference, row.instant);
            }
            rows.add(row);
        }

        int unparsedTimestamps = 0;
        double counter = 0.0;
        int synthetic = 0;
        for (DecisionRecord row : rows) {
            if (row.instant == null && FieldAliases.lookup(row.payload, FieldAliases.TIMESTAMP) != null) {
                unparsedTimestamps++;
            }
            if (row.sourceTime != null) {
                continue;
            }
            if (row.instant != null) {
                row.t = Math.max(0.0, row.instant - sessionReference);
                row.sourceTime = row.instant;
            } else {
                row.t = counter;
                counter += 1.0;
                row.syntheticTime = true;
                synthetic++;
            }
        }

        if (unparsedTimestamps > 0) {
            notes.add(unparsedTimestamps + " decisions carry a timestamp that could not be parsed.");
        }
        if (synthetic > 0) {
            notes.add(synthetic + " decisions have no timing signal; synthetic sequence 't' assigned "
                    + "(ordering only, not elapsed time).");
        }
        if (skipped > 0) {
            notes.add(skipped + " decisions are not JSON objects and were skipped.");
        }
        return new Result(rows, notes, skipped);
    }

    /**
     * Ascending sort by canonical {@code t}, ties broken by input position.
     */
    public static List<DecisionRecord> sortedByTime(List<DecisionRecord> records) {
        List<DecisionRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.<DecisionRecord>comparingDouble(r -> r.t).thenComparingInt(r -> r.sourceIndex));
        return sorted;
    }

    static String canonicalAgent(String rawAgent) {
        if (rawAgent == null) {
            return null;
        }
        String mapped = AGENT_MAP.get(StringSemantics.canonical(rawAgent));
        return mapped == null ? rawAgent : mapped;
    }

    private static DecisionRecord resolveFields(ObjectNode raw, int index, List<String> notes) {
        DecisionRecord row = new DecisionRecord();
        row.payload = raw.deepCopy();
        row.sourceIndex = index;

        String rawAgent = JsonNodeUtils.asNullableText(FieldAliases.lookup(raw, FieldAliases.AGENT));
        row.agent = canonicalAgent(rawAgent);
        String actorType = JsonNodeUtils.asNullableText(raw.get("actor_type"));
        String actorSource = actorType != null ? actorType : rawAgent;
        row.actorType = actorSource == null ? null : actorSource.trim().toLowerCase(Locale.ROOT);

        row.action = JsonNodeUtils.asNullableText(FieldAliases.lookup(raw, FieldAliases.ACTION));
        row.eventType = JsonNodeUtils.asNullableText(raw.get("event_type"));

        row.durationS = JsonNodeUtils.asNullableDouble(FieldAliases.lookup(raw, FieldAliases.DURATION_S));
        row.latencyMs = JsonNodeUtils.asNullableDouble(FieldAliases.lookup(raw, FieldAliases.LATENCY_MS));
        row.rawLatency = JsonNodeUtils.asNullableDouble(raw.get(FieldAliases.BARE_LATENCY));
        row.correct = JsonNodeUtils.asNullableBoolean(FieldAliases.lookup(raw, FieldAliases.CORRECT));

        row.instant = TimeParser.tryParseInstant(FieldAliases.lookup(raw, FieldAliases.TIMESTAMP), notes);

        JsonNode explicitT = raw.get("t");
        if (JsonNodeUtils.isNumber(explicitT)) {
            row.t = explicitT.asDouble();
            row.sourceTime = row.t;
        }
        return row;
    }

    private static Map<String, String> buildAgentMap() {
        Map<String, String> map = new HashMap<>();
        map.put("human", DecisionRecord.AGENT_HUMAN);
        map.put("ai", DecisionRecord.AGENT_AI);
        map.put("system", DecisionRecord.AGENT_SYSTEM);
        return map;
    }

    /**
     * Normalized records in input order plus diagnostics.
     */
    public static final class Result {
        public final List<DecisionRecord> records;
        public final List<String> notes;
        public final int skipped;

        Result(List<DecisionRecord> records, List<String> notes, int skipped) {
            this.records = Collections.unmodifiableList(records);
            this.notes = Collections.unmodifiableList(notes);
            this.skipped = skipped;
        }
    }
}
