package com.haic.analytics.window;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.haic.analytics.model.DecisionRecord;
import com.haic.analytics.model.WindowSummary;
import com.haic.analytics.parse.FieldAliases;
import com.haic.analytics.parse.JsonNodeUtils;
import com.haic.analytics.time.TimeParser;
import com.haic.analytics.util.JsonSupport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Applies window bounds to the decision stream and the optional parallel event stream.
 *
 * <p>Bounds are inclusive at both ends. Decisions and events are matched on the same source time:
 * numeric {@code t}, else a parseable timestamp alias in epoch seconds. Items with neither are
 * excluded and counted in a note. Events are diagnostic only. Inputs are never mutated.</p>
 */
public final class RecordFilter {
    static final String UNRESOLVED_NOTE = "Window bounds could not be resolved; no items selected.";
    static final String MISSING_TIME_SUFFIX = " without numeric 't' or a parseable timestamp were excluded from windowing.";

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(RecordFilter.class);

    private RecordFilter() {}

    public static Result apply(JsonNode artifact, List<DecisionRecord> decisions, WindowSpec window) {
        List<JsonNode> events = extractEvents(artifact);
        int decisionsTotal = decisions.size();
        int eventsTotal = events.size();

        if (window == null) {
            return passthrough(decisions, events);
        }

        ResolvedWindow resolved = WindowResolver.resolve(artifact, decisions, window);
        List<String> notes = new ArrayList<>(resolved.notes);

        if (!resolved.isResolved()) {
            notes.add(UNRESOLVED_NOTE);
            WindowSummary summary = new WindowSummary(resolved.basis, resolved.requested, resolved.effective,
                    new WindowSummary.Counts(decisionsTotal, 0, eventsTotal, 0), 0.0, notes);
            return new Result(Collections.emptyList(), Collections.emptyList(), summary);
        }

        List<DecisionRecord> keptDecisions = new ArrayList<>();
        int missingDecisionTimes = 0;
        for (DecisionRecord decision : decisions) {
            if (decision.sourceTime == null) {
                missingDecisionTimes++;
                continue;
            }
            if (resolved.contains(decision.sourceTime)) {
                keptDecisions.add(decision);
            }
        }

        List<JsonNode> keptEvents = new ArrayList<>();
        int missingEventTimes = 0;
        for (JsonNode event : events) {
            Double time = eventTime(event, notes);
            if (time == null) {
                missingEventTimes++;
                continue;
            }
            if (resolved.contains(time)) {
                keptEvents.add(event);
            }
        }

        if (missingDecisionTimes > 0) {
            notes.add(missingDecisionTimes + " decisions" + MISSING_TIME_SUFFIX);
        }
        if (missingEventTimes > 0) {
            notes.add(missingEventTimes + " events" + MISSING_TIME_SUFFIX);
        }

        double durationS = Math.max(0.0, resolved.tEnd - resolved.tStart);
        LOG.debug("Window {} kept decisions={}/{} events={}/{}",
                resolved.requested, keptDecisions.size(), decisionsTotal, keptEvents.size(), eventsTotal);
        WindowSummary summary = new WindowSummary(resolved.basis, resolved.requested, resolved.effective,
                new WindowSummary.Counts(decisionsTotal, keptDecisions.size(), eventsTotal, keptEvents.size()),
                durationS, notes);
        return new Result(keptDecisions, keptEvents, summary);
    }

    /**
     * Source time of a raw event, resolved the way the normalizer resolves it for decisions.
     */
    static Double eventTime(JsonNode event, List<String> notes) {
        JsonNode t = event.get("t");
        if (JsonNodeUtils.isNumber(t)) {
            return t.asDouble();
        }
        return TimeParser.tryParseInstant(FieldAliases.lookup(event, FieldAliases.TIMESTAMP), notes);
    }

    /**
     * Object entries of the artifact's {@code events} array; empty when absent.
     */
    public static List<JsonNode> extractEvents(JsonNode artifact) {
        if (artifact == null || !artifact.isObject()) {
            return Collections.emptyList();
        }
        JsonNode events = artifact.get("events");
        if (events == null || !events.isArray()) {
            return Collections.emptyList();
        }
        List<JsonNode> out = new ArrayList<>(events.size());
        for (JsonNode event : events) {
            if (event.isObject()) {
                out.add(event);
            }
        }
        return out;
    }

    private static Result passthrough(List<DecisionRecord> decisions, List<JsonNode> events) {
        Double min = null;
        Double max = null;
        for (DecisionRecord decision : decisions) {
            min = min == null ? decision.t : Math.min(min, decision.t);
            max = max == null ? decision.t : Math.max(max, decision.t);
        }
        double durationS = min == null ? 0.0 : Math.max(0.0, max - min);

        ObjectNode requested = JsonSupport.MAPPER.createObjectNode();
        requested.put("mode", "full");
        WindowSummary summary = new WindowSummary("absolute", requested,
                WindowSummary.EffectiveBounds.absolute(min, max),
                new WindowSummary.Counts(decisions.size(), decisions.size(), events.size(), events.size()),
                durationS, Collections.emptyList());
        return new Result(decisions, events, summary);
    }

    public static final class Result {
        public final List<DecisionRecord> decisions;
        public final List<JsonNode> events;
        public final WindowSummary summary;

        Result(List<DecisionRecord> decisions, List<JsonNode> events, WindowSummary summary) {
            this.decisions = Collections.unmodifiableList(new ArrayList<>(decisions));
            this.events = Collections.unmodifiableList(new ArrayList<>(events));
            this.summary = summary;
        }
    }
}
