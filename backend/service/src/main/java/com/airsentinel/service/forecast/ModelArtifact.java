package com.airsentinel.service.forecast;

import java.time.Instant;
import java.util.Objects;

/**
 * A trained per-city model. Immutable; a retrain produces a new artifact that replaces this one
 * in {@link ModelRegistry}.
 *
 * @param windowEnd timestamp of the newest reading used for training
 */
public record ModelArtifact(
        String city,
        Instant trainedAt,
        Instant windowStart,
        Instant windowEnd,
        int observationCount,
        FeatureSpec featureSpec,
        SeasonalModelState state
) {
    public ModelArtifact {
        Objects.requireNonNull(city, "city is required");
        Objects.requireNonNull(trainedAt, "trainedAt is required");
        Objects.requireNonNull(windowStart, "windowStart is required");
        Objects.requireNonNull(windowEnd, "windowEnd is required");
        Objects.requireNonNull(featureSpec, "featureSpec is required");
        Objects.requireNonNull(state, "state is required");
    }
}
