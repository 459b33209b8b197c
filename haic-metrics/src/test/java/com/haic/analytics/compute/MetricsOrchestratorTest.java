package com.haic.analytics.compute;

import com.fasterxml.jackson.databind.JsonNode;
import com.haic.analytics.config.MetricsOptions;
import com.haic.analytics.config.Profile;
import com.haic.analytics.error.InputShapeException;
import com.haic.analytics.interaction.InteractionMetrics;
import com.haic.analytics.quality.DecisionInputValidator;
import com.haic.analytics.util.JsonSupport;
import com.haic.analytics.window.WindowSpec;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsOrchestratorTest {
    private final MetricsOrchestrator orchestrator = new MetricsOrchestrator();

    @Test
    void humanAndAiDecisionListYieldsCoreCatalogue() {
        Map<String, Object> human = new LinkedHashMap<>();
        human.put("t", 1);
        human.put("agent", "human");
        human.put("duration_s", 2);
        human.put("correct", true);
        Map<String, Object> ai = new LinkedHashMap<>();
        ai.put("t", 10);
        ai.put("agent", "ai");
        ai.put("latency_ms", 120);

        MetricsResult result = orchestrator.computeMetrics(Arrays.asList(human, ai));

        assertTrue(result.ok);
        assertTrue(result.metric("F") > 0.0);
        assertEquals(1.0, result.metric("human_rt_n"));
        assertEquals(1.0, result.metric("ai_latency_n"));
        assertEquals(120.0, result.metric("ai_latency_p50_ms"));
        assertNull(result.metric("outcome_precision"));
        assertNull(result.outcome);
        assertEquals(1, result.humanResponseTimes.n);
        assertEquals(result.interaction.frequency, result.metric("F"));
    }

    @Test
    void relativeWindowOverArtifactCountsDecisionsUsed() throws Exception {
        JsonNode artifact = JsonSupport.MAPPER.readTree("{\"meta\":{\"timestamps\":{\"start_time\":0}},"
                + "\"decisions\":[{\"t\":1,\"agent\":\"human\"},{\"t\":10,\"agent\":\"ai\"},{\"t\":30,\"agent\":\"human\"}]}");

        MetricsResult narrow = orchestrator.computeMetrics(artifact,
                MetricsOptions.defaults().withWindow(WindowSpec.relative(0, 15)));
        MetricsResult wide = orchestrator.computeMetrics(artifact,
                MetricsOptions.defaults().withWindow(WindowSpec.relative(0, 40)));

        assertEquals(2, narrow.windowSummary.counts().decisionsUsed);
        assertEquals(3, wide.windowSummary.counts().decisionsUsed);
    }

    @Test
    void absoluteIsoWindowIsBoundaryInclusive() throws Exception {
        JsonNode decisions = JsonSupport.MAPPER.readTree("["
                + "{\"agent\":\"human\",\"action\":\"a\",\"timestamp\":\"2026-01-01T00:00:01Z\"},"
                + "{\"agent\":\"human\",\"action\":\"a\",\"timestamp\":\"2026-01-01T00:10:00Z\"},"
                + "{\"agent\":\"human\",\"action\":\"a\",\"timestamp\":\"2026-01-01T00:20:00Z\"}]");
        WindowSpec window = WindowSpec.fromJson(JsonSupport.MAPPER.readTree(
                "{\"basis\":\"absolute\",\"start\":\"2026-01-01T00:00:00Z\",\"end\":\"2026-01-01T00:10:00Z\"}"));

        MetricsResult result = orchestrator.computeMetrics(decisions, MetricsOptions.defaults().withWindow(window));

        assertEquals(2, result.windowSummary.counts().decisionsUsed);
        assertEquals(600.0, result.windowSummary.durationS());
    }

    @Test
    void emptyDecisionsSucceedWithWarningAndNeutralMetrics() {
        MetricsResult result = orchestrator.computeMetrics(Collections.emptyList());

        assertTrue(result.ok);
        assertTrue(result.warnings.contains(DecisionInputValidator.EMPTY_DECISIONS_WARNING));
        assertEquals(0.0, result.metric("F"));
        assertEquals(0.0, result.metric("D"));
        assertEquals(0.0, result.metric("HCL"));
        assertEquals(1.0, result.metric("Tr"));
        assertEquals(0.0, result.metric("A"));
        assertEquals(0.0, result.metric("S"));
        assertEquals(0.0, result.metric("EL"));
        assertEquals(1.0, result.metric("EfficiencyScore"));
        assertEquals(0.0, result.metric("human_rt_n"));
        assertEquals(0.0, result.metric("ai_latency_mean_ms"));
    }

    @Test
    void fullProfileAddsOutcomeCatalogue() throws Exception {
        JsonNode decisions = JsonSupport.MAPPER.readTree("["
                + "{\"t\":0,\"agent\":\"ai\",\"prediction\":\"positive\",\"ground_truth\":\"positive\"},"
                + "{\"t\":1,\"agent\":\"ai\",\"prediction\":\"positive\",\"ground_truth\":\"negative\"},"
                + "{\"t\":2,\"agent\":\"ai\",\"prediction\":\"negative\",\"ground_truth\":\"positive\"},"
                + "{\"t\":3,\"agent\":\"ai\",\"prediction\":\"positive\",\"ground_truth\":\"positive\"}]");

        MetricsResult result = orchestrator.computeMetrics(decisions, MetricsOptions.defaults().withProfile(Profile.FULL));

        double tp = result.metric("outcome_tp");
        double fp = result.metric("outcome_fp");
        double fn = result.metric("outcome_fn");
        assertEquals(2.0, tp);
        assertEquals(tp / (tp + fp), result.metric("outcome_precision"), 1e-12);
        assertEquals(tp / (tp + fn), result.metric("outcome_recall"), 1e-12);
    }

    @Test
    void fixtureSessionProducesConsistentSummary() throws Exception {
        JsonNode artifact = fixture("fixtures/triage_session.json");

        MetricsResult result = orchestrator.computeMetrics(artifact, MetricsOptions.defaults().withProfile("full"));

        assertEquals(6.0 / (110.0 / 60.0), result.metric("F"), 1e-9);
        assertEquals(3.0, result.metric("human_rt_n"));
        assertEquals(200.0, result.metric("ai_latency_p50_ms"), 1e-9);
        assertEquals(1.0, result.metric("outcome_tp"));
        assertEquals(1.0, result.metric("outcome_fn"));
        assertEquals(1.0, result.metric("outcome_tn"));
        assertEquals(0.5, result.metric("outcome_recall"), 1e-12);
        assertEquals(0.5, result.outcome.recall, 1e-12);
        assertEquals(0.0, result.metric("outcome_system_reliability_pct"));
        assertEquals(result.metric("outcome_mean_response_time_s"), result.metric("outcome_time_to_resolution_s"));
        assertEquals(2, result.windowSummary.counts().eventsUsed);
        assertTrue(result.warnings.isEmpty());
    }

    @Test
    void lastWindowUsesMetaEndTime() throws Exception {
        JsonNode artifact = fixture("fixtures/triage_session.json");

        MetricsResult result = orchestrator.computeMetrics(artifact,
                MetricsOptions.defaults().withWindow(WindowSpec.relativeLast(30)));

        assertEquals(2, result.windowSummary.counts().decisionsUsed);
        assertEquals(6, result.windowSummary.counts().decisionsTotal);
        assertEquals(1, result.windowSummary.counts().eventsUsed);
        assertEquals(90.0, result.windowSummary.effective().tStartRelS);
    }

    @Test
    void computationIsIdempotent() throws Exception {
        JsonNode artifact = fixture("fixtures/triage_session.json");
        MetricsOptions options = MetricsOptions.defaults().withProfile(Profile.FULL).withBaselineS(60.0);

        String first = orchestrator.computeMetrics(artifact, options).toJson();
        String second = orchestrator.computeMetrics(artifact, options).toJson();

        assertEquals(first, second);
    }

    @Test
    void warningsCanBeSuppressed() {
        MetricsResult result = orchestrator.computeMetrics(Collections.emptyList(),
                MetricsOptions.defaults().withIncludeWarnings(false));

        assertNull(result.warnings);
        assertFalse(result.toJson().contains("\"warnings\""));
    }

    @Test
    void resultSerializesWithSnakeCaseSummary() throws Exception {
        MetricsResult result = orchestrator.computeMetrics(fixture("fixtures/triage_session.json"));

        JsonNode json = JsonSupport.MAPPER.readTree(result.toJson());

        assertTrue(json.get("ok").asBoolean());
        assertEquals(6, json.path("window_summary").path("counts").path("decisions_used").asInt());
        assertEquals("full", json.path("window_summary").path("requested").path("mode").asText());
        assertTrue(json.path("metrics").has("EfficiencyScore"));
        assertTrue(json.path("warnings").isArray());
    }

    @Test
    void wrongTopLevelShapesAreFatal() throws Exception {
        InputShapeException scalar = assertThrows(InputShapeException.class,
                () -> orchestrator.computeMetrics("decisions"));
        assertEquals("decisions_not_list", scalar.reason());

        InputShapeException missing = assertThrows(InputShapeException.class,
                () -> orchestrator.computeMetrics(JsonSupport.MAPPER.readTree("{\"meta\":{}}")));
        assertEquals("missing_decisions", missing.reason());

        InputShapeException notList = assertThrows(InputShapeException.class,
                () -> orchestrator.computeMetrics(JsonSupport.MAPPER.readTree("{\"decisions\":{\"t\":1}}")));
        assertEquals("decisions_not_list", notList.reason());
    }

    @Test
    void malformedRecordsAreSkippedNotFatal() throws Exception {
        MetricsResult result = orchestrator.computeMetrics(JsonSupport.MAPPER.readTree(
                "[{\"t\":0,\"agent\":\"human\",\"action\":\"a\",\"duration_s\":1}, \"oops\"]"));

        assertEquals(1.0, result.metric("human_rt_n"));
        assertTrue(result.warnings.contains("decision[1] is not an object"));
        assertTrue(result.warnings.contains("1 decisions are not JSON objects and were skipped."));
    }

    @Test
    void computeAllKeepsInputOrder() throws Exception {
        List<JsonNode> sessions = Arrays.asList(
                JsonSupport.MAPPER.readTree("[{\"t\":0,\"agent\":\"human\",\"duration_s\":1}]"),
                JsonSupport.MAPPER.readTree("[]"),
                JsonSupport.MAPPER.readTree("[{\"t\":0,\"agent\":\"human\",\"duration_s\":1},"
                        + "{\"t\":5,\"agent\":\"human\",\"duration_s\":3}]"));

        List<MetricsResult> results = orchestrator.computeAll(sessions, MetricsOptions.defaults());

        assertEquals(3, results.size());
        assertEquals(1.0, results.get(0).metric("human_rt_n"));
        assertEquals(0.0, results.get(1).metric("human_rt_n"));
        assertEquals(2.0, results.get(2).metric("human_rt_n"));
    }

    @Test
    void computeByAgentSplitsCanonicalAgents() throws Exception {
        Map<String, InteractionMetrics> byAgent = orchestrator.computeByAgent(
                fixture("fixtures/triage_session.json"), MetricsOptions.defaults());

        assertNotNull(byAgent.get("AI"));
        assertNotNull(byAgent.get("HUMAN"));
        assertEquals(0.2, byAgent.get("AI").meanDuration, 1e-9);
    }

    private static JsonNode fixture(String resource) throws Exception {
        try (InputStream in = MetricsOrchestratorTest.class.getClassLoader().getResourceAsStream(resource)) {
            assertNotNull(in, "missing fixture " + resource);
            return JsonSupport.MAPPER.readTree(in);
        }
    }
}
