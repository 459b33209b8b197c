package com.haic.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;
import com.haic.analytics.util.JsonSupport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecisionInputValidatorTest {
    private final DecisionInputValidator validator = new DecisionInputValidator();

    @Test
    void wellFormedDecisionsPassWithoutWarnings() throws Exception {
        JsonNode decisions = JsonSupport.MAPPER.readTree("[{\"t\":1,\"action\":\"review\"},{\"ts\":2,\"type\":\"x\"}]");

        DecisionInputValidator.ValidationResult result = validator.validate(decisions);

        assertTrue(result.valid);
        assertTrue(result.warnings.isEmpty());
    }

    @Test
    void emptyListIsValidWithWarning() throws Exception {
        DecisionInputValidator.ValidationResult result = validator.validate(JsonSupport.MAPPER.readTree("[]"));

        assertTrue(result.valid);
        assertEquals(1, result.warnings.size());
        assertEquals(DecisionInputValidator.EMPTY_DECISIONS_WARNING, result.warnings.get(0));
    }

    @Test
    void nonListContainerIsInvalid() throws Exception {
        DecisionInputValidator.ValidationResult result =
                validator.validate(JsonSupport.MAPPER.readTree("{\"t\":1}"));

        assertFalse(result.valid);
        assertEquals("decisions_not_list", result.reason);
    }

    @Test
    void missingKeysAndNonObjectsBecomeWarnings() throws Exception {
        DecisionInputValidator.ValidationResult result =
                validator.validate(JsonSupport.MAPPER.readTree("[{\"agent\":\"human\"}, 7]"));

        assertTrue(result.valid);
        assertTrue(result.warnings.contains("decision[0] missing time key (timestamp|ts|t|time)"));
        assertTrue(result.warnings.contains("decision[0] missing type key (event_type|action|type)"));
        assertTrue(result.warnings.contains("decision[1] is not an object"));
    }

    @Test
    void onlyTheFirstTenRecordsAreCheckedForKeys() throws Exception {
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < 10; i++) {
            json.append("{\"t\":").append(i).append(",\"action\":\"a\"},");
        }
        json.append("{\"agent\":\"human\"}]");

        DecisionInputValidator.ValidationResult result = validator.validate(JsonSupport.MAPPER.readTree(json.toString()));

        assertTrue(result.warnings.isEmpty());
    }
}
