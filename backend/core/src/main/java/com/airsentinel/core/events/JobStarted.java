package com.airsentinel.core.events;

import java.time.Instant;

public record JobStarted(Instant timestamp, String jobName) implements Event {
    @Override
    public String type() {
        return "JobStarted";
    }
}
