package com.haic.analytics.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonSupportTest {

    @Test
    void toTreeReturnsJsonNodesAsIsAndConvertsCollections() throws Exception {
        JsonNode node = JsonSupport.MAPPER.readTree("{\"a\":1}");
        assertSame(node, JsonSupport.toTree(node));

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("agent", "human");
        record.put("duration_s", 2.0);
        JsonNode list = JsonSupport.toTree(Arrays.asList(record));
        assertTrue(list.isArray());
        assertEquals("human", list.get(0).get("agent").asText());
        assertEquals(2.0, list.get(0).get("duration_s").asDouble());
    }

    @Test
    void toJsonWritesCompactJson() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("ok", true);
        assertEquals("{\"ok\":true}", JsonSupport.toJson(value));
    }
}
