package com.airsentinel.ingest.api;

import java.util.List;

/**
 * Hourly PM2.5 values from the upstream air-quality API.
 *
 * <p>Implementations throw {@link com.airsentinel.ingest.error.TransientProviderException} for
 * failures worth retrying and {@link com.airsentinel.ingest.error.SchemaMismatchException} when
 * the response does not have the expected shape.
 */
public interface MeasurementProvider {
    MeasurementPage fetchPage(PageRequest request);

    /**
     * PM2.5 sensor ids for a city that has none configured. Providers without a location
     * directory find nothing.
     */
    default List<String> discoverSensors(String city) {
        return List.of();
    }
}
