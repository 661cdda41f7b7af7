package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ForecastPoint(
        Instant datetime,
        @JsonProperty("pm25_predicted") double pm25Predicted,
        @JsonProperty("pm25_lower") double pm25Lower,
        @JsonProperty("pm25_upper") double pm25Upper,
        @JsonProperty("aqi_predicted") int aqiPredicted,
        @JsonProperty("aqi_category") AqiCategory aqiCategory
) {
}
