package com.airsentinel.core.events;

import java.time.Instant;

public record CityIngested(
        Instant timestamp,
        String city,
        int fetched,
        int added,
        int duplicates,
        int rejected
) implements Event {
    @Override
    public String type() {
        return "CityIngested";
    }
}
