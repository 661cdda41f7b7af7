package com.airsentinel.service.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record CityStats(
        String city,
        @JsonProperty("avg_aqi") double avgAqi,
        @JsonProperty("max_aqi") int maxAqi,
        @JsonProperty("min_aqi") int minAqi,
        @JsonProperty("avg_pm25") double avgPm25,
        @JsonProperty("max_pm25") double maxPm25,
        @JsonProperty("min_pm25") double minPm25,
        @JsonProperty("total_readings") int totalReadings,
        @JsonProperty("first_reading") Instant firstReading,
        @JsonProperty("last_reading") Instant lastReading,
        @JsonProperty("category_distribution") Map<String, Integer> categoryDistribution
) {
}
