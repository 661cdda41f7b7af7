package com.airsentinel.service.query;

import com.airsentinel.core.aqi.AqiClassifier;
import com.airsentinel.core.model.AqiCategory;
import com.airsentinel.core.model.ClassifiedReading;
import com.airsentinel.core.model.SensorReading;
import com.airsentinel.ingest.api.ReadingStore;
import com.airsentinel.service.error.InvalidQueryParamsException;
import com.airsentinel.service.error.NoDataException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read side over the store. Nothing is cached: every answer is classified from the store's
 * current snapshot.
 */
public class CurrentReadingService {
    private final ReadingStore store;
    private final CityCatalog cities;
    private final AqiClassifier classifier;

    public CurrentReadingService(ReadingStore store, CityCatalog cities, AqiClassifier classifier) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.cities = Objects.requireNonNull(cities, "cities is required");
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
    }

    public List<String> cities() {
        return cities.names();
    }

    public CurrentReading current(String city) {
        String canonical = cities.resolve(city);
        SensorReading latest = store.latest(canonical).orElseThrow(() -> new NoDataException(canonical));
        return classify(latest);
    }

    /**
     * Latest reading of each configured city that has data, in configuration order.
     */
    public List<CurrentReading> allCurrent() {
        List<CurrentReading> readings = new ArrayList<>();
        for (String city : cities.names()) {
            Optional<SensorReading> latest = store.latest(city);
            latest.ifPresent(reading -> readings.add(classify(reading)));
        }
        return readings;
    }

    /**
     * Readings from {@code hours} before the latest reading up to it, keeping the newest
     * {@code limit}.
     */
    public HistoryResponse history(String city, int hours, int limit) {
        if (hours <= 0 || limit <= 0) {
            throw new InvalidQueryParamsException("hours and limit must be positive");
        }
        String canonical = cities.resolve(city);
        SensorReading latest = store.latest(canonical).orElseThrow(() -> new NoDataException(canonical));
        Instant end = latest.timestamp();
        List<SensorReading> window = store.query(canonical, end.minus(Duration.ofHours(hours)), end);
        List<SensorReading> kept = window.size() > limit ? window.subList(window.size() - limit, window.size()) : window;
        List<CurrentReading> data = new ArrayList<>(kept.size());
        for (SensorReading reading : kept) {
            data.add(classify(reading));
        }
        return new HistoryResponse(canonical, hours, data.size(), data);
    }

    public CityStats stats(String city) {
        String canonical = cities.resolve(city);
        List<SensorReading> readings = store.query(canonical, Instant.MIN, Instant.MAX);
        if (readings.isEmpty()) {
            throw new NoDataException(canonical);
        }
        double pm25Sum = 0;
        double pm25Min = Double.MAX_VALUE;
        double pm25Max = -Double.MAX_VALUE;
        long aqiSum = 0;
        int aqiMin = Integer.MAX_VALUE;
        int aqiMax = Integer.MIN_VALUE;
        Map<AqiCategory, Integer> counts = new LinkedHashMap<>();
        for (SensorReading reading : readings) {
            ClassifiedReading classified = classifier.classify(reading.pm25());
            pm25Sum += reading.pm25();
            pm25Min = Math.min(pm25Min, reading.pm25());
            pm25Max = Math.max(pm25Max, reading.pm25());
            aqiSum += classified.aqiValue();
            aqiMin = Math.min(aqiMin, classified.aqiValue());
            aqiMax = Math.max(aqiMax, classified.aqiValue());
            counts.merge(classified.category(), 1, Integer::sum);
        }
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (AqiCategory category : AqiCategory.values()) {
            Integer count = counts.get(category);
            if (count != null) {
                distribution.put(category.label(), count);
            }
        }
        int n = readings.size();
        return new CityStats(
                canonical,
                (double) aqiSum / n,
                aqiMax,
                aqiMin,
                pm25Sum / n,
                pm25Max,
                pm25Min,
                n,
                readings.get(0).timestamp(),
                readings.get(n - 1).timestamp(),
                distribution
        );
    }

    private CurrentReading classify(SensorReading reading) {
        ClassifiedReading classified = classifier.classify(reading.pm25());
        return new CurrentReading(reading.city(), reading.timestamp(), reading.pm25(), classified.aqiValue(), classified.category());
    }
}
