package com.airsentinel.service.query;

import com.airsentinel.core.aqi.AqiClassifier;
import com.airsentinel.core.model.ClassifiedReading;
import com.airsentinel.core.model.ForecastPoint;
import com.airsentinel.core.model.SensorReading;
import com.airsentinel.ingest.api.ReadingStore;
import com.airsentinel.service.config.ForecastConfig;
import com.airsentinel.service.error.InvalidForecastHorizonException;
import com.airsentinel.service.error.ModelNotTrainedException;
import com.airsentinel.service.forecast.ModelArtifact;
import com.airsentinel.service.forecast.ModelRegistry;
import com.airsentinel.service.forecast.SeasonalForecastModel;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Hourly forecasts from the city's current artifact. The first point is the hour after the
 * newer of the latest stored reading and the artifact's training window end.
 */
public class ForecastService {
    private final ModelRegistry registry;
    private final ReadingStore store;
    private final CityCatalog cities;
    private final AqiClassifier classifier;
    private final ForecastConfig config;

    public ForecastService(
            ModelRegistry registry,
            ReadingStore store,
            CityCatalog cities,
            AqiClassifier classifier,
            ForecastConfig config
    ) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.cities = Objects.requireNonNull(cities, "cities is required");
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
        this.config = Objects.requireNonNull(config, "config is required");
    }

    public ForecastResponse forecast(String city) {
        return forecast(city, config.defaultDays());
    }

    public ForecastResponse forecast(String city, int days) {
        if (days < 1 || days > config.maxDays()) {
            throw new InvalidForecastHorizonException(days, config.maxDays());
        }
        String canonical = cities.resolve(city);
        ModelArtifact artifact = registry.current(canonical).orElseThrow(() -> new ModelNotTrainedException(canonical));
        SeasonalForecastModel model = SeasonalForecastModel.of(artifact);

        Instant start = startAfter(canonical, artifact);
        int hours = days * 24;
        List<ForecastPoint> points = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            Instant at = start.plus(i, ChronoUnit.HOURS);
            SeasonalForecastModel.Prediction prediction = model.predict(at);
            ClassifiedReading classified = classifier.classify(prediction.pm25());
            points.add(new ForecastPoint(
                    at,
                    prediction.pm25(),
                    prediction.lower(),
                    prediction.upper(),
                    classified.aqiValue(),
                    classified.category()
            ));
        }
        return new ForecastResponse(canonical, days, points.size(), points);
    }

    public Optional<ModelArtifact> model(String city) {
        return registry.current(cities.resolve(city));
    }

    public int defaultDays() {
        return config.defaultDays();
    }

    private Instant startAfter(String city, ModelArtifact artifact) {
        Instant anchor = artifact.windowEnd();
        Optional<SensorReading> latest = store.latest(city);
        if (latest.isPresent() && latest.get().timestamp().isAfter(anchor)) {
            anchor = latest.get().timestamp();
        }
        return anchor.truncatedTo(ChronoUnit.HOURS).plus(1, ChronoUnit.HOURS);
    }
}
