package com.airsentinel.ingest.openaq;

import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.ingest.error.SchemaMismatchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Picks a city's PM2.5 sensors out of an OpenAQ v3 locations response.
 *
 * <pre>
 * { "results": [ { "name": "US Diplomatic Post: Lahore", "locality": "Lahore",
 *                  "sensors": [ { "id": 8118, "parameter": { "name": "pm25" } } ] } ] }
 * </pre>
 *
 * A location belongs to the city when the city name appears, ignoring case, in its
 * {@code locality} or its {@code name}.
 */
public final class LocationDirectoryParser {
    private LocationDirectoryParser() {
    }

    public static List<String> pm25SensorsFor(String body, String city) {
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new SchemaMismatchException("Locations response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaMismatchException("Locations response root must be an object");
        }
        JsonNode results = root.get("results");
        if (results == null || !results.isArray()) {
            throw new SchemaMismatchException("Locations response is missing the 'results' array");
        }

        String needle = city.toLowerCase(Locale.ROOT);
        List<String> sensorIds = new ArrayList<>();
        for (JsonNode location : results) {
            if (!matches(location.path("locality"), needle) && !matches(location.path("name"), needle)) {
                continue;
            }
            for (JsonNode sensor : location.path("sensors")) {
                String parameter = sensor.path("parameter").path("name").asText("");
                JsonNode id = sensor.get("id");
                if (MeasurementPageParser.EXPECTED_PARAMETER.equalsIgnoreCase(parameter) && id != null && id.isValueNode()) {
                    String sensorId = id.asText();
                    if (!sensorIds.contains(sensorId)) {
                        sensorIds.add(sensorId);
                    }
                }
            }
        }
        return sensorIds;
    }

    private static boolean matches(JsonNode field, String needle) {
        return field.isTextual() && field.asText().toLowerCase(Locale.ROOT).contains(needle);
    }
}
