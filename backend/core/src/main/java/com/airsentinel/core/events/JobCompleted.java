package com.airsentinel.core.events;

import java.time.Instant;

public record JobCompleted(
        Instant timestamp,
        String jobName,
        boolean success,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "JobCompleted";
    }
}
