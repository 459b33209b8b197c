package com.haic.analytics.window;

import com.fasterxml.jackson.databind.JsonNode;

import com.haic.analytics.error.InvalidWindowException;
import com.haic.analytics.error.TimeFormatException;
import com.haic.analytics.model.DecisionRecord;
import com.haic.analytics.model.WindowSummary;
import com.haic.analytics.parse.JsonNodeUtils;
import com.haic.analytics.time.TimeParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a {@link WindowSpec} to absolute epoch bounds.
 *
 * <p>Transitions:
 * - relative + last=N: [max(t0, end - N), end], end from meta end_time else max(record time)
 * - relative + start/end: [t0 + start, t0 + end]
 * - absolute + start/end: each bound parsed as epoch seconds or ISO-8601
 * </p>
 *
 * <p>t0 comes from {@code meta.timestamps.start_time}, else min(record time) with a note. When
 * neither exists the window is returned unresolved; this is the only path that selects nothing
 * without raising. {@code end >= start} is enforced after resolution for every basis.</p>
 */
public final class WindowResolver {
    static final String START_FALLBACK_NOTE =
            "Fallback: meta.timestamps.start_time missing; using min(decision.t) as session start.";
    static final String NO_SESSION_START_NOTE = "No usable timestamps found to establish session start.";
    static final String NO_SESSION_END_NOTE =
            "Cannot resolve relative 'last' window end; missing session end time.";

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(WindowResolver.class);

    private WindowResolver() {}

    public static ResolvedWindow resolve(JsonNode artifact, List<DecisionRecord> records, WindowSpec spec) {
        List<String> notes = new ArrayList<>();
        if (spec.basis() == WindowSpec.Basis.RELATIVE) {
            return resolveRelative(artifact, records, spec, notes);
        }
        return resolveAbsolute(spec, notes);
    }

    /**
     * Session start: artifact meta first, then the earliest record time.
     */
    public static Double sessionStart(JsonNode artifact, List<DecisionRecord> records, List<String> notes) {
        Double metaStart = metaTimestamp(artifact, "start_time", notes);
        if (metaStart != null) {
            return metaStart;
        }
        double[] range = recordTimeRange(records);
        if (range != null) {
            notes.add(START_FALLBACK_NOTE);
            return range[0];
        }
        notes.add(NO_SESSION_START_NOTE);
        return null;
    }

    public static Double sessionEnd(JsonNode artifact, List<DecisionRecord> records, List<String> notes) {
        Double metaEnd = metaTimestamp(artifact, "end_time", notes);
        if (metaEnd != null) {
            return metaEnd;
        }
        double[] range = recordTimeRange(records);
        return range == null ? null : range[1];
    }

    private static ResolvedWindow resolveRelative(
            JsonNode artifact, List<DecisionRecord> records, WindowSpec spec, List<String> notes) {
        boolean hasStart = spec.has("start");
        boolean hasEnd = spec.has("end");
        boolean hasLast = spec.has("last");

        if (hasLast && (hasStart || hasEnd)) {
            throw new InvalidWindowException("last_with_start_end",
                    "For relative windows, use either {'last': N} or {'start':..., 'end':...}, not both.");
        }
        if (hasLast) {
            if (!JsonNodeUtils.isNumber(spec.get("last"))) {
                throw new InvalidWindowException("last_not_numeric",
                        "window['last'] must be a number (seconds) for relative windows.");
            }
        } else {
            if (!(hasStart && hasEnd)) {
                throw new InvalidWindowException("missing_start_end",
                        "Relative window requires both 'start' and 'end' (seconds) unless using 'last'.");
            }
            if (!(JsonNodeUtils.isNumber(spec.get("start")) && JsonNodeUtils.isNumber(spec.get("end")))) {
                throw new InvalidWindowException("start_end_not_numeric",
                        "Relative window 'start'/'end' must be numbers (seconds).");
            }
        }

        Double t0 = sessionStart(artifact, records, notes);
        if (t0 == null) {
            LOG.debug("Relative window {} left unresolved: no session start", spec);
            return ResolvedWindow.unresolved(spec, notes);
        }

        double tStart;
        double tEnd;
        if (hasLast) {
            Double sessionEnd = sessionEnd(artifact, records, notes);
            if (sessionEnd == null) {
                notes.add(NO_SESSION_END_NOTE);
                return ResolvedWindow.unresolved(spec, notes);
            }
            double lastS = spec.get("last").asDouble();
            tEnd = sessionEnd;
            tStart = Math.max(t0, tEnd - lastS);
        } else {
            tStart = t0 + spec.get("start").asDouble();
            tEnd = t0 + spec.get("end").asDouble();
        }
        requireOrdered(tStart, tEnd, "Relative window 'end' must be >= 'start'.");

        WindowSummary.EffectiveBounds effective =
                new WindowSummary.EffectiveBounds(tStart, tEnd, tStart - t0, tEnd - t0, t0);
        return new ResolvedWindow(spec.basis().wireName(), spec.requested(), tStart, tEnd, effective, notes);
    }

    private static ResolvedWindow resolveAbsolute(WindowSpec spec, List<String> notes) {
        if (spec.has("last")) {
            throw new InvalidWindowException("last_not_relative", "'last' is only supported for relative windows.");
        }
        if (!(spec.has("start") && spec.has("end"))) {
            throw new InvalidWindowException("missing_start_end",
                    "Absolute window requires both 'start' and 'end' (epoch seconds or ISO strings).");
        }
        double tStart = TimeParser.parse(spec.get("start"), notes);
        double tEnd = TimeParser.parse(spec.get("end"), notes);
        requireOrdered(tStart, tEnd, "Absolute window 'end' must be >= 'start'.");

        return new ResolvedWindow(spec.basis().wireName(), spec.requested(), tStart, tEnd,
                WindowSummary.EffectiveBounds.absolute(tStart, tEnd), notes);
    }

    private static void requireOrdered(double tStart, double tEnd, String message) {
        if (tEnd < tStart) {
            throw new InvalidWindowException("window_end_before_start", message);
        }
    }

    private static Double metaTimestamp(JsonNode artifact, String key, List<String> notes) {
        if (artifact == null || !artifact.isObject()) {
            return null;
        }
        JsonNode value = artifact.path("meta").path("timestamps").path(key);
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return TimeParser.parseIso(value.asText(), notes);
            } catch (TimeFormatException ex) {
                notes.add("meta.timestamps." + key + " is not a parseable time; ignored.");
                return null;
            }
        }
        return null;
    }

    /**
     * [min, max] over records that carry a source time, or null when none do.
     */
    static double[] recordTimeRange(List<DecisionRecord> records) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (DecisionRecord record : records) {
            if (record.sourceTime == null) {
                continue;
            }
            min = Math.min(min, record.sourceTime);
            max = Math.max(max, record.sourceTime);
        }
        return min == Double.POSITIVE_INFINITY ? null : new double[] {min, max};
    }
}
