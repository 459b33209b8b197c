package com.haic.analytics.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Canonical view of one logged action, produced by the record normalizer.
 *
 * <p>The original payload is kept verbatim in {@link #payload}; canonical fields are resolved
 * from alias tables. After normalization {@link #t} is always set.</p>
 */
public class DecisionRecord {
    public static final String AGENT_HUMAN = "HUMAN";
    public static final String AGENT_AI = "AI";
    public static final String AGENT_SYSTEM = "SYS";

    public ObjectNode payload;
    // Position in the raw input; orders records that share a `t`.
    public int sourceIndex;

    // Canonical time axis in seconds (explicit, instant-derived or synthetic).
    public double t;
    // Explicit numeric `t` if given, else the parsed timestamp instant; used for windowing.
    public Double sourceTime;
    // Parsed timestamp in epoch seconds, if any alias resolved.
    public Double instant;
    public boolean syntheticTime;

    public String agent;
    public String actorType;
    public String action;
    public String eventType;

    public Double durationS;
    public Double latencyMs;
    // Bare `latency` value of unknown unit.
    public Double rawLatency;
    public Boolean correct;

    public DecisionRecord() {}

    public boolean hasAgent() {
        return agent != null || actorType != null;
    }

    public JsonNode field(String key) {
        if (payload == null) {
            return MissingNode.getInstance();
        }
        return payload.path(key);
    }

    public boolean has(String key) {
        return payload != null && payload.has(key);
    }

    /**
     * Milliseconds from {@code latency_ms}, else from a bare {@code latency} via the
     * ms-vs-seconds heuristic.
     */
    public Double effectiveLatencyMs() {
        if (latencyMs != null) {
            return latencyMs;
        }
        return TimingSignals.bareLatencyToMs(rawLatency);
    }

    /**
     * Seconds from {@code duration_s}, else from latency converted to seconds.
     */
    public Double durationSeconds() {
        if (durationS != null) {
            return durationS;
        }
        Double ms = effectiveLatencyMs();
        return ms == null ? null : ms / 1000.0;
    }
}
