package com.airsentinel.service.config;

import java.time.Duration;

/**
 * @param defaultDays horizon used when a request does not name one
 * @param maxDays largest accepted horizon
 * @param minHistoryHours hourly readings a city needs before it can be trained
 * @param trainingInterval how often all cities are retrained
 */
public record ForecastConfig(int defaultDays, int maxDays, int minHistoryHours, Duration trainingInterval) {
    public ForecastConfig {
        if (maxDays <= 0) {
            throw new IllegalArgumentException("maxDays must be positive");
        }
        if (defaultDays <= 0 || defaultDays > maxDays) {
            throw new IllegalArgumentException("defaultDays must be between 1 and maxDays");
        }
        if (minHistoryHours <= 0) {
            throw new IllegalArgumentException("minHistoryHours must be positive");
        }
        trainingInterval = trainingInterval == null ? Duration.ofHours(6) : trainingInterval;
    }

    public static ForecastConfig defaults() {
        return new ForecastConfig(7, 14, 48, Duration.ofHours(6));
    }
}
