package com.airsentinel.core.events;

import java.time.Instant;

public record ModelPublished(
        Instant timestamp,
        String city,
        Instant trainedAt,
        Instant windowStart,
        Instant windowEnd,
        int observations
) implements Event {
    @Override
    public String type() {
        return "ModelPublished";
    }
}
