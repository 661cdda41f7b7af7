package com.airsentinel.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A configured city and the provider sensors that report PM2.5 for it.
 */
public record CitySource(String name, List<String> sensorIds) {
    public CitySource {
        Objects.requireNonNull(name, "name is required");
        sensorIds = sensorIds == null ? List.of() : List.copyOf(sensorIds);
    }
}
