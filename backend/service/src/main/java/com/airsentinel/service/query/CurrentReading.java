package com.airsentinel.service.query;

import com.airsentinel.core.model.AqiCategory;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CurrentReading(
        String city,
        Instant datetime,
        @JsonProperty("pm25_value") double pm25Value,
        @JsonProperty("aqi_value") int aqiValue,
        @JsonProperty("aqi_category") AqiCategory aqiCategory
) {
}
