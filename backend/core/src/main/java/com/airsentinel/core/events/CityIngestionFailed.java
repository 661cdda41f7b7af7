package com.airsentinel.core.events;

import java.time.Instant;

/**
 * @param code stable failure code, e.g. {@code ingestion_failed} or {@code schema_mismatch}
 */
public record CityIngestionFailed(
        Instant timestamp,
        String city,
        String code,
        String message
) implements Event {
    @Override
    public String type() {
        return "CityIngestionFailed";
    }
}
