package com.airsentinel.ingest.api;

import com.airsentinel.core.bus.EventBus;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

public record CollectorContext(
        EventBus eventBus,
        ReadingStore readingStore,
        Clock clock,
        Map<String, Object> config
) {
    public CollectorContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(readingStore, "readingStore is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(config, "config is required");
    }
}
