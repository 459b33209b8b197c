package com.haic.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.haic.analytics.util.JsonSupport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FieldAliasesTest {

    @Test
    void lookupFollowsAliasOrder() throws Exception {
        JsonNode record = JsonSupport.MAPPER.readTree(
                "{\"role\":\"reviewer\",\"actor\":\"operator\",\"created_at\":\"2026-01-01T00:00:00Z\",\"inference_ms\":80}");

        assertEquals("operator", FieldAliases.lookup(record, FieldAliases.AGENT).asText());
        assertEquals("2026-01-01T00:00:00Z", FieldAliases.lookup(record, FieldAliases.TIMESTAMP).asText());
        assertEquals(80, FieldAliases.lookup(record, FieldAliases.LATENCY_MS).asInt());
        assertNull(FieldAliases.lookup(record, FieldAliases.DURATION_S));
    }

    @Test
    void unknownCanonicalFieldIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FieldAliases.aliasesFor("nope"));
    }
}
