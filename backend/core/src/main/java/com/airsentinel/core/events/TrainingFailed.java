package com.airsentinel.core.events;

import java.time.Instant;

public record TrainingFailed(Instant timestamp, String city, String message) implements Event {
    @Override
    public String type() {
        return "TrainingFailed";
    }
}
