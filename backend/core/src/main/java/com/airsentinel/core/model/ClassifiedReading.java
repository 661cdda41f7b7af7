package com.airsentinel.core.model;

import java.util.Objects;

public record ClassifiedReading(int aqiValue, AqiCategory category) {
    public ClassifiedReading {
        Objects.requireNonNull(category, "category is required");
    }
}
