package com.airsentinel.ingest.api;

import java.time.Instant;
import java.util.List;

public record MeasurementPage(List<Row> rows) {
    public MeasurementPage {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public Instant lastTimestamp() {
        return rows.isEmpty() ? null : rows.get(rows.size() - 1).periodStart();
    }

    /**
     * A validated provider row: the start of the averaging period and the reported value.
     */
    public record Row(Instant periodStart, double value) {
    }
}
