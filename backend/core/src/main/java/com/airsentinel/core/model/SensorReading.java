package com.airsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One hourly PM2.5 observation as delivered by the provider.
 *
 * @param pm25 concentration in µg/m³; validated by the store, not here
 */
public record SensorReading(
        String city,
        String sensorId,
        Instant timestamp,
        double pm25
) {
    public SensorReading {
        Objects.requireNonNull(city, "city is required");
        Objects.requireNonNull(sensorId, "sensorId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
