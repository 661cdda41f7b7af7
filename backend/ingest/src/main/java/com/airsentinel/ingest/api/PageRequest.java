package com.airsentinel.ingest.api;

import java.time.Instant;
import java.util.Objects;

/**
 * @param from inclusive cursor; the first row returned is at or after it
 * @param to inclusive end of the requested window
 */
public record PageRequest(String sensorId, Instant from, Instant to, int limit) {
    public PageRequest {
        Objects.requireNonNull(sensorId, "sensorId is required");
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }
}
