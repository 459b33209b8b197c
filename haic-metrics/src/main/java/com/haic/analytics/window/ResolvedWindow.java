package com.haic.analytics.window;

import com.fasterxml.jackson.databind.node.ObjectNode;

import com.haic.analytics.model.WindowSummary;

import java.util.Collections;
import java.util.List;

/**
 * Absolute epoch bounds for a window, or unresolved bounds when no session reference exists.
 */
public final class ResolvedWindow {
    public final String basis;
    public final ObjectNode requested;
    public final Double tStart;
    public final Double tEnd;
    public final WindowSummary.EffectiveBounds effective;
    public final List<String> notes;

    ResolvedWindow(String basis, ObjectNode requested, Double tStart, Double tEnd,
            WindowSummary.EffectiveBounds effective, List<String> notes) {
        this.basis = basis;
        this.requested = requested;
        this.tStart = tStart;
        this.tEnd = tEnd;
        this.effective = effective;
        this.notes = Collections.unmodifiableList(notes);
    }

    static ResolvedWindow unresolved(WindowSpec spec, List<String> notes) {
        return new ResolvedWindow(spec.basis().wireName(), spec.requested(), null, null,
                WindowSummary.EffectiveBounds.EMPTY, notes);
    }

    public boolean isResolved() {
        return tStart != null && tEnd != null;
    }

    public boolean contains(double t) {
        return isResolved() && tStart <= t && t <= tEnd;
    }
}
