package com.airsentinel.ingest.error;

import com.airsentinel.core.error.AirSentinelException;

public class IngestionFailedException extends AirSentinelException {
    private final String city;

    public IngestionFailedException(String city, String message, Throwable cause) {
        super("ingestion_failed", "Ingestion failed for " + city + ": " + message, cause);
        this.city = city;
    }

    public String city() {
        return city;
    }
}
