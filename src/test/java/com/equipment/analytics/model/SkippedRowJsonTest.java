package com.equipment.analytics.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class SkippedRowJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void rejectionFieldsAreInlined() throws Exception {
        JsonNode json = mapper.valueToTree(new SkippedRow(2, RowRejection.invalidNumber("flowrate", "bad")));

        assertThat(json.get("row").asInt()).isEqualTo(2);
        assertThat(json.get("reason").asText()).isEqualTo("INVALID_NUMBER");
        assertThat(json.get("column").asText()).isEqualTo("flowrate");
        assertThat(json.get("value").asText()).isEqualTo("bad");
        assertThat(json.get("message").asText()).isEqualTo("Invalid number for 'flowrate': 'bad'");
    }

    @Test
    void missingFieldOmitsValue() throws Exception {
        JsonNode json = mapper.valueToTree(new SkippedRow(1, RowRejection.missingField("name")));

        assertThat(json.has("value")).isFalse();
        assertThat(json.get("message").asText()).isEqualTo("Missing required field 'name'");
    }
}
