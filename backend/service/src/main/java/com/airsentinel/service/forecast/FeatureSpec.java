package com.airsentinel.service.forecast;

import java.time.Duration;
import java.util.List;

/**
 * Inputs a model was fitted on. Seasonalities use UTC calendar fields.
 */
public record FeatureSpec(Duration frequency, List<String> seasonalities, int minHistoryHours) {
    public static final String HOUR_OF_DAY = "hour_of_day";
    public static final String DAY_OF_WEEK = "day_of_week";

    public FeatureSpec {
        frequency = frequency == null ? Duration.ofHours(1) : frequency;
        seasonalities = seasonalities == null ? List.of(HOUR_OF_DAY, DAY_OF_WEEK) : List.copyOf(seasonalities);
        if (minHistoryHours <= 0) {
            throw new IllegalArgumentException("minHistoryHours must be positive");
        }
    }

    public static FeatureSpec hourly(int minHistoryHours) {
        return new FeatureSpec(Duration.ofHours(1), List.of(HOUR_OF_DAY, DAY_OF_WEEK), minHistoryHours);
    }
}
