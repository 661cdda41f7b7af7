package com.airsentinel.service.forecast;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.ModelPublished;
import com.airsentinel.core.events.TrainingFailed;
import com.airsentinel.core.model.SensorReading;
import com.airsentinel.ingest.api.ReadingStore;
import com.airsentinel.service.error.InsufficientHistoryException;
import com.airsentinel.service.query.CityCatalog;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fits a {@link SeasonalForecastModel} per city and publishes it to the {@link ModelRegistry}.
 * A failed training run leaves the city's previous artifact untouched.
 */
public class ForecastTrainer {
    private static final Logger LOGGER = Logger.getLogger(ForecastTrainer.class.getName());

    private final ReadingStore store;
    private final ModelRegistry registry;
    private final CityCatalog cities;
    private final FeatureSpec featureSpec;
    private final EventBus eventBus;
    private final Clock clock;

    public ForecastTrainer(
            ReadingStore store,
            ModelRegistry registry,
            CityCatalog cities,
            FeatureSpec featureSpec,
            EventBus eventBus,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.cities = Objects.requireNonNull(cities, "cities is required");
        this.featureSpec = Objects.requireNonNull(featureSpec, "featureSpec is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public ModelArtifact train(String city) {
        String canonical = cities.resolve(city);
        try {
            ModelArtifact artifact = fit(canonical);
            registry.publish(artifact);
            eventBus.publish(new ModelPublished(
                    clock.instant(),
                    canonical,
                    artifact.trainedAt(),
                    artifact.windowStart(),
                    artifact.windowEnd(),
                    artifact.observationCount()
            ));
            LOGGER.info(() -> "Published model for " + canonical + " on " + artifact.observationCount()
                    + " readings [" + artifact.windowStart() + ", " + artifact.windowEnd() + "]");
            return artifact;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Training failed for " + canonical, e);
            eventBus.publish(new TrainingFailed(clock.instant(), canonical, e.getMessage()));
            throw e;
        }
    }

    /**
     * Trains every configured city independently; one city failing does not stop the others.
     */
    public TrainingSummary trainAll() {
        List<ModelArtifact> published = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (String city : cities.names()) {
            try {
                published.add(train(city));
            } catch (RuntimeException e) {
                failures.put(city, e.getMessage());
            }
        }
        return new TrainingSummary(published, failures);
    }

    private ModelArtifact fit(String city) {
        List<SensorReading> readings = store.query(city, Instant.MIN, Instant.MAX);
        if (readings.size() < featureSpec.minHistoryHours()) {
            throw new InsufficientHistoryException(city, readings.size(), featureSpec.minHistoryHours());
        }
        SeasonalModelState state = SeasonalForecastModel.fit(readings);
        return new ModelArtifact(
                city,
                clock.instant(),
                readings.get(0).timestamp(),
                readings.get(readings.size() - 1).timestamp(),
                readings.size(),
                featureSpec,
                state
        );
    }

    public record TrainingSummary(List<ModelArtifact> published, Map<String, String> failures) {
        public boolean success() {
            return failures.isEmpty();
        }
    }
}
