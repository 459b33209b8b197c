package com.haic.analytics.window;

import com.fasterxml.jackson.databind.JsonNode;
import com.haic.analytics.model.DecisionRecord;
import com.haic.analytics.model.WindowSummary;
import com.haic.analytics.parse.RecordNormalizer;
import com.haic.analytics.util.JsonSupport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordFilterTest {
    private static final String SESSION = "{\"meta\":{\"timestamps\":{\"start_time\":0}},"
            + "\"decisions\":[{\"t\":1,\"agent\":\"human\"},{\"t\":10,\"agent\":\"ai\"},{\"t\":30,\"agent\":\"human\"}],"
            + "\"events\":[{\"t\":2},{\"t\":20},{\"kind\":\"untimed\"}]}";

    @Test
    void relativeWindowKeepsInclusiveRangeForDecisionsAndEvents() throws Exception {
        JsonNode artifact = JsonSupport.MAPPER.readTree(SESSION);

        RecordFilter.Result narrow = RecordFilter.apply(artifact, decisions(artifact), WindowSpec.relative(0, 15));
        RecordFilter.Result wide = RecordFilter.apply(artifact, decisions(artifact), WindowSpec.relative(0, 40));

        assertEquals(2, narrow.summary.counts().decisionsUsed);
        assertEquals(3, narrow.summary.counts().decisionsTotal);
        assertEquals(1, narrow.summary.counts().eventsUsed);
        assertEquals(3, narrow.summary.counts().eventsTotal);
        assertTrue(narrow.summary.notes().contains("1 events" + RecordFilter.MISSING_TIME_SUFFIX));
        assertEquals(15.0, narrow.summary.durationS());
        assertEquals("relative", narrow.summary.basis());

        assertEquals(3, wide.summary.counts().decisionsUsed);
        assertEquals(2, wide.summary.counts().eventsUsed);
    }

    @Test
    void boundsAreInclusiveAtBothEnds() throws Exception {
        JsonNode artifact = JsonSupport.MAPPER.readTree(SESSION);

        RecordFilter.Result result = RecordFilter.apply(artifact, decisions(artifact), WindowSpec.relative(10, 30));

        assertEquals(2, result.decisions.size());
        assertEquals(10.0, result.decisions.get(0).t);
        assertEquals(30.0, result.decisions.get(1).t);
    }

    @Test
    void absoluteIsoWindowSpanningTenMinutesKeepsTwoOfThree() throws Exception {
        double start = 1767225600.0;
        String json = "[{\"agent\":\"human\",\"t\":" + (start + 1) + "},"
                + "{\"agent\":\"human\",\"t\":" + (start + 600) + "},"
                + "{\"agent\":\"human\",\"t\":" + (start + 1200) + "}]";
        List<DecisionRecord> records = decisions(JsonSupport.MAPPER.readTree(json));

        RecordFilter.Result result = RecordFilter.apply(null, records,
                WindowSpec.absolute("2026-01-01T00:00:00Z", "2026-01-01T00:10:00Z"));

        assertEquals(2, result.summary.counts().decisionsUsed);
        assertEquals(600.0, result.summary.durationS());
        assertEquals("absolute", result.summary.basis());
        assertEquals(start, result.summary.effective().tStartEpoch);
    }

    @Test
    void eventsWithIsoTimestampsAreMatchedLikeDecisions() throws Exception {
        JsonNode artifact = JsonSupport.MAPPER.readTree(
                "{\"decisions\":[{\"timestamp\":\"2026-01-01T00:00:05Z\"}],"
                        + "\"events\":[{\"timestamp\":\"2026-01-01T00:00:05Z\"},"
                        + "{\"time\":\"2026-01-01T00:20:00Z\"},{\"timestamp\":\"soon\"}]}");

        RecordFilter.Result result = RecordFilter.apply(artifact, decisions(artifact),
                WindowSpec.absolute("2026-01-01T00:00:00Z", "2026-01-01T00:10:00Z"));

        assertEquals(1, result.summary.counts().decisionsUsed);
        assertEquals(1, result.summary.counts().eventsUsed);
        assertEquals(3, result.summary.counts().eventsTotal);
        assertTrue(result.summary.notes().contains("1 events" + RecordFilter.MISSING_TIME_SUFFIX));
    }

    @Test
    void noWindowPassesEverythingThroughWithFullRange() throws Exception {
        JsonNode artifact = JsonSupport.MAPPER.readTree(SESSION);

        RecordFilter.Result result = RecordFilter.apply(artifact, decisions(artifact), null);
        WindowSummary summary = result.summary;

        assertEquals(3, result.decisions.size());
        assertEquals(3, result.events.size());
        assertEquals("full", summary.requested().get("mode").asText());
        assertEquals(1.0, summary.effective().tStartEpoch);
        assertEquals(30.0, summary.effective().tEndEpoch);
        assertEquals(29.0, summary.durationS());
        assertEquals(summary.counts().decisionsTotal, summary.counts().decisionsUsed);
    }

    @Test
    void syntheticTimesAreExcludedFromWindowing() throws Exception {
        List<DecisionRecord> records = decisions(JsonSupport.MAPPER.readTree(
                "[{\"t\":1,\"agent\":\"human\"},{\"agent\":\"ai\"}]"));

        RecordFilter.Result result = RecordFilter.apply(null, records, WindowSpec.relative(0, 100));

        assertEquals(1, result.summary.counts().decisionsUsed);
        assertTrue(result.summary.notes().contains("1 decisions" + RecordFilter.MISSING_TIME_SUFFIX));
    }

    @Test
    void unresolvedWindowSelectsNothingAndSaysSo() throws Exception {
        List<DecisionRecord> records = decisions(JsonSupport.MAPPER.readTree("[{\"agent\":\"ai\"}]"));

        RecordFilter.Result result = RecordFilter.apply(null, records, WindowSpec.relativeLast(10));

        assertTrue(result.decisions.isEmpty());
        assertEquals(1, result.summary.counts().decisionsTotal);
        assertTrue(result.summary.notes().contains(RecordFilter.UNRESOLVED_NOTE));
    }

    @Test
    void enlargingRelativeEndNeverDecreasesDecisionsUsed() throws Exception {
        JsonNode artifact = JsonSupport.MAPPER.readTree(SESSION);
        List<DecisionRecord> records = decisions(artifact);

        int previous = 0;
        for (int end = 0; end <= 40; end += 5) {
            int used = RecordFilter.apply(artifact, records, WindowSpec.relative(0, end)).summary.counts().decisionsUsed;
            assertTrue(used >= previous, "end=" + end);
            assertTrue(used <= records.size());
            previous = used;
        }
    }

    private static List<DecisionRecord> decisions(JsonNode root) {
        JsonNode decisions = root.isArray() ? root : root.path("decisions");
        List<JsonNode> rows = new ArrayList<>();
        decisions.forEach(rows::add);
        return RecordNormalizer.normalize(rows).records;
    }
}
