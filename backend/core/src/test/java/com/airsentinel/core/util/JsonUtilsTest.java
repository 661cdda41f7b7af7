package com.airsentinel.core.util;

import com.airsentinel.core.model.AqiCategory;
import com.airsentinel.core.model.ForecastPoint;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndIgnoresUnknownProperties() throws Exception {
        ObjectMapper first = JsonUtils.objectMapper();
        assertSame(first, JsonUtils.objectMapper());
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

        Payload parsed = first.readValue(
                "{\"name\":\"ok\",\"createdAt\":\"2026-02-01T00:00:00Z\",\"unknown\":1}",
                Payload.class
        );
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), parsed.createdAt());
    }

    @Test
    void instantsAreWrittenAsIsoStringsAndNullsAreDropped() throws Exception {
        JsonNode tree = JsonUtils.objectMapper().readTree(JsonUtils.objectMapper().writeValueAsString(
                new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z"))));

        assertEquals("2026-02-01T00:00:00Z", tree.get("createdAt").asText());
        assertFalse(tree.has("optional"));
    }

    @Test
    void forecastPointUsesWireNamesAndCategoryLabels() throws Exception {
        ForecastPoint point = new ForecastPoint(
                Instant.parse("2026-02-01T01:00:00Z"), 40.0, 34.0, 46.0, 112, AqiCategory.UNHEALTHY_FOR_SENSITIVE_GROUPS);

        JsonNode tree = JsonUtils.objectMapper().valueToTree(point);

        assertEquals("2026-02-01T01:00:00Z", tree.get("datetime").asText());
        assertEquals(40.0, tree.get("pm25_predicted").asDouble());
        assertEquals(112, tree.get("aqi_predicted").asInt());
        assertEquals("Unhealthy for Sensitive Groups", tree.get("aqi_category").asText());
        assertEquals(AqiCategory.VERY_UNHEALTHY, JsonUtils.objectMapper().readValue("\"Very Unhealthy\"", AqiCategory.class));
    }

    private record Payload(String name, String optional, Instant createdAt) {
    }
}
