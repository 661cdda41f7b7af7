package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AqiCategory {
    GOOD("Good"),
    MODERATE("Moderate"),
    UNHEALTHY_FOR_SENSITIVE_GROUPS("Unhealthy for Sensitive Groups"),
    UNHEALTHY("Unhealthy"),
    VERY_UNHEALTHY("Very Unhealthy"),
    HAZARDOUS("Hazardous");

    private final String label;

    AqiCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static AqiCategory fromLabel(String label) {
        for (AqiCategory category : values()) {
            if (category.label.equalsIgnoreCase(label) || category.name().equalsIgnoreCase(label)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown AQI category: " + label);
    }
}
