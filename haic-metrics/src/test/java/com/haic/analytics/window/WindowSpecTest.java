package com.haic.analytics.window;

import com.haic.analytics.error.InvalidWindowException;
import com.haic.analytics.util.JsonSupport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WindowSpecTest {

    @Test
    void parsesBasisAndKeepsVerbatimRequest() throws Exception {
        WindowSpec spec = WindowSpec.fromJson(JsonSupport.MAPPER.readTree(
                "{\"basis\":\"relative\",\"start\":0,\"end\":15,\"label\":\"first quarter\"}"));

        assertEquals(WindowSpec.Basis.RELATIVE, spec.basis());
        assertEquals("first quarter", spec.requested().get("label").asText());
    }

    @Test
    void rejectsUnknownBasisAndNonObjects() throws Exception {
        InvalidWindowException basis = assertThrows(InvalidWindowException.class,
                () -> WindowSpec.fromJson(JsonSupport.MAPPER.readTree("{\"basis\":\"sliding\"}")));
        assertEquals("invalid_basis", basis.reason());

        InvalidWindowException shape = assertThrows(InvalidWindowException.class,
                () -> WindowSpec.fromJson(JsonSupport.MAPPER.readTree("[1,2]")));
        assertEquals("window_not_object", shape.reason());
    }

    @Test
    void requestedIsACopy() {
        WindowSpec spec = WindowSpec.relativeLast(30);
        spec.requested().put("last", 1);

        assertEquals(30.0, spec.get("last").asDouble());
    }
}
