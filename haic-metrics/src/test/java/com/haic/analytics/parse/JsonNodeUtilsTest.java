package com.haic.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.haic.analytics.util.JsonSupport;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonNodeUtilsTest {

    @Test
    void firstPresentSkipsNullAndEmptyValues() throws Exception {
        JsonNode record = JsonSupport.MAPPER.readTree("{\"a\":null,\"b\":\"\",\"c\":[],\"d\":\"x\",\"e\":\"y\"}");
        assertEquals("x", JsonNodeUtils.firstPresent(record, Arrays.asList("a", "b", "c", "d", "e")).asText());
        assertNull(JsonNodeUtils.firstPresent(record, Arrays.asList("a", "missing")));
    }

    @Test
    void asNullableDoubleAcceptsNumericStringsOnly() {
        assertEquals(2.5, JsonNodeUtils.asNullableDouble(TextNode.valueOf(" 2.5 ")));
        assertNull(JsonNodeUtils.asNullableDouble(TextNode.valueOf("fast")));
        assertNull(JsonNodeUtils.asNullableDouble(TextNode.valueOf("NaN")));
        assertNull(JsonNodeUtils.asNullableDouble(NullNode.getInstance()));
    }

    @Test
    void asNullableBooleanUnderstandsCommonSpellings() throws Exception {
        assertEquals(Boolean.TRUE, JsonNodeUtils.asNullableBoolean(TextNode.valueOf("Yes")));
        assertEquals(Boolean.FALSE, JsonNodeUtils.asNullableBoolean(TextNode.valueOf("0")));
        assertEquals(Boolean.TRUE, JsonNodeUtils.asNullableBoolean(JsonSupport.MAPPER.readTree("1")));
        assertNull(JsonNodeUtils.asNullableBoolean(JsonSupport.MAPPER.readTree("2")));
        assertNull(JsonNodeUtils.asNullableBoolean(TextNode.valueOf("maybe")));
    }

    @Test
    void isTruthyTreatsZeroFalseAndEmptyAsFalse() throws Exception {
        assertTrue(JsonNodeUtils.isTruthy(JsonSupport.MAPPER.readTree("true")));
        assertTrue(JsonNodeUtils.isTruthy(TextNode.valueOf("yes")));
        assertFalse(JsonNodeUtils.isTruthy(JsonSupport.MAPPER.readTree("0")));
        assertFalse(JsonNodeUtils.isTruthy(TextNode.valueOf("")));
        assertFalse(JsonNodeUtils.isTruthy(null));
    }
}
