package com.airsentinel.ingest.api;

import com.airsentinel.core.model.SensorReading;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-city, append-only store of hourly readings keyed by (city, timestamp).
 */
public interface ReadingStore {
    AppendResult append(String city, List<SensorReading> readings);

    /**
     * Readings with {@code from <= timestamp <= to}, ascending by timestamp.
     */
    List<SensorReading> query(String city, Instant from, Instant to);

    Optional<SensorReading> latest(String city);
}
