package com.haic.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.List;

/**
 * Descriptive record of which window was applied and how many items it kept.
 * Produced once per computation and never mutated.
 */
@JsonPropertyOrder({"basis", "requested", "effective", "counts", "duration_s", "notes"})
public final class WindowSummary {
    private final String basis;
    private final JsonNode requested;
    private final EffectiveBounds effective;
    private final Counts counts;
    private final double durationS;
    private final List<String> notes;

    public WindowSummary(
            String basis,
            JsonNode requested,
            EffectiveBounds effective,
            Counts counts,
            double durationS,
            List<String> notes) {
        this.basis = basis;
        this.requested = requested == null ? null : requested.deepCopy();
        this.effective = effective == null ? EffectiveBounds.EMPTY : effective;
        this.counts = counts;
        this.durationS = durationS;
        this.notes = notes == null ? Collections.emptyList() : List.copyOf(notes);
    }

    @JsonProperty("basis")
    public String basis() {
        return basis;
    }

    @JsonProperty("requested")
    public JsonNode requested() {
        return requested == null ? null : requested.deepCopy();
    }

    @JsonProperty("effective")
    public EffectiveBounds effective() {
        return effective;
    }

    @JsonProperty("counts")
    public Counts counts() {
        return counts;
    }

    @JsonProperty("duration_s")
    public double durationS() {
        return durationS;
    }

    @JsonProperty("notes")
    public List<String> notes() {
        return notes;
    }

    /**
     * Absolute (and, for relative windows, session-relative) bounds actually applied.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"t_start_epoch", "t_end_epoch", "t_start_rel_s", "t_end_rel_s", "session_start_epoch"})
    public static final class EffectiveBounds {
        public static final EffectiveBounds EMPTY = new EffectiveBounds(null, null, null, null, null);

        @JsonProperty("t_start_epoch")
        public final Double tStartEpoch;
        @JsonProperty("t_end_epoch")
        public final Double tEndEpoch;
        @JsonProperty("t_start_rel_s")
        public final Double tStartRelS;
        @JsonProperty("t_end_rel_s")
        public final Double tEndRelS;
        @JsonProperty("session_start_epoch")
        public final Double sessionStartEpoch;

        public EffectiveBounds(Double tStartEpoch, Double tEndEpoch, Double tStartRelS, Double tEndRelS,
                Double sessionStartEpoch) {
            this.tStartEpoch = tStartEpoch;
            this.tEndEpoch = tEndEpoch;
            this.tStartRelS = tStartRelS;
            this.tEndRelS = tEndRelS;
            this.sessionStartEpoch = sessionStartEpoch;
        }

        public static EffectiveBounds absolute(Double tStartEpoch, Double tEndEpoch) {
            return new EffectiveBounds(tStartEpoch, tEndEpoch, null, null, null);
        }
    }

    @JsonPropertyOrder({"decisions_total", "decisions_used", "events_total", "events_used"})
    public static final class Counts {
        @JsonProperty("decisions_total")
        public final int decisionsTotal;
        @JsonProperty("decisions_used")
        public final int decisionsUsed;
        @JsonProperty("events_total")
        public final int eventsTotal;
        @JsonProperty("events_used")
        public final int eventsUsed;

        public Counts(int decisionsTotal, int decisionsUsed, int eventsTotal, int eventsUsed) {
            this.decisionsTotal = decisionsTotal;
            this.decisionsUsed = decisionsUsed;
            this.eventsTotal = eventsTotal;
            this.eventsUsed = eventsUsed;
        }
    }
}
