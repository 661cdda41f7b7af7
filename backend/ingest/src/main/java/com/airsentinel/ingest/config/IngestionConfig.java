package com.airsentinel.ingest.config;

import java.time.Duration;

/**
 * @param pageSize rows requested per provider call; the provider caps this at 1000
 * @param historyDays how far back a city with no stored readings is backfilled
 * @param parallelism cities ingested concurrently
 * @param countryId provider country searched for the sensors of cities configured without any
 */
public record IngestionConfig(
        int pageSize,
        int historyDays,
        Duration interval,
        Duration requestTimeout,
        int parallelism,
        int countryId,
        RetrySettings retry
) {
    public static final int PROVIDER_PAGE_CAP = 1000;
    public static final int DEFAULT_COUNTRY_ID = 109;

    public IngestionConfig {
        if (pageSize <= 0 || pageSize > PROVIDER_PAGE_CAP) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + PROVIDER_PAGE_CAP);
        }
        if (historyDays <= 0) {
            throw new IllegalArgumentException("historyDays must be positive");
        }
        interval = interval == null ? Duration.ofHours(1) : interval;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
        parallelism = parallelism <= 0 ? 5 : parallelism;
        countryId = countryId <= 0 ? DEFAULT_COUNTRY_ID : countryId;
        retry = retry == null ? RetrySettings.defaults() : retry;
    }

    public static IngestionConfig defaults() {
        return new IngestionConfig(PROVIDER_PAGE_CAP, 90, Duration.ofHours(1), Duration.ofSeconds(10), 5, DEFAULT_COUNTRY_ID,
                RetrySettings.defaults());
    }
}
