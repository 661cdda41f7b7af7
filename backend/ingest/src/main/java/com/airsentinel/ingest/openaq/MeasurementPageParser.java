package com.airsentinel.ingest.openaq;

import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.ingest.api.MeasurementPage;
import com.airsentinel.ingest.error.SchemaMismatchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates an OpenAQ v3 sensor hours response and reduces it to {@link MeasurementPage}.
 *
 * <pre>
 * { "results": [ { "value": 41.2,
 *                  "parameter": { "name": "pm25" },
 *                  "period": { "datetimeFrom": { "utc": "2026-01-01T00:00:00Z" } } } ] }
 * </pre>
 *
 * A structural deviation anywhere in the page rejects the whole page. Value ranges are not
 * checked here; out-of-range concentrations are the store's concern.
 */
public final class MeasurementPageParser {
    static final String EXPECTED_PARAMETER = "pm25";

    private MeasurementPageParser() {
    }

    public static MeasurementPage parse(String body) {
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new SchemaMismatchException("Response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaMismatchException("Response root must be an object");
        }
        JsonNode results = root.get("results");
        if (results == null || !results.isArray()) {
            throw new SchemaMismatchException("Response is missing the 'results' array");
        }

        List<MeasurementPage.Row> rows = new ArrayList<>(results.size());
        int index = 0;
        for (JsonNode row : results) {
            rows.add(parseRow(row, index++));
        }
        return new MeasurementPage(rows);
    }

    private static MeasurementPage.Row parseRow(JsonNode row, int index) {
        if (!row.isObject()) {
            throw rowError(index, "row is not an object");
        }
        JsonNode value = row.get("value");
        if (value == null || !value.isNumber()) {
            throw rowError(index, "'value' must be a number");
        }
        JsonNode parameterName = row.path("parameter").path("name");
        if (!parameterName.isMissingNode() && !EXPECTED_PARAMETER.equalsIgnoreCase(parameterName.asText())) {
            throw rowError(index, "unexpected parameter '" + parameterName.asText() + "'");
        }
        JsonNode utc = row.path("period").path("datetimeFrom").path("utc");
        if (!utc.isTextual()) {
            throw rowError(index, "'period.datetimeFrom.utc' must be a string");
        }
        Instant periodStart;
        try {
            periodStart = Instant.parse(utc.asText());
        } catch (DateTimeParseException e) {
            throw new SchemaMismatchException("Row " + index + ": unparseable timestamp '" + utc.asText() + "'", e);
        }
        return new MeasurementPage.Row(periodStart, value.asDouble());
    }

    private static SchemaMismatchException rowError(int index, String detail) {
        return new SchemaMismatchException("Row " + index + ": " + detail);
    }
}
