package com.airsentinel.service.store;

import com.airsentinel.core.aqi.AqiClassifier;
import com.airsentinel.core.error.ClassificationRangeException;
import com.airsentinel.core.model.SensorReading;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.ingest.api.AppendResult;
import com.airsentinel.ingest.api.ReadingStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Append-only per-city hourly series.
 *
 * <p>Writers for the same city are serialized on a per-city lock. Each append publishes a new
 * immutable snapshot through a volatile field, so readers never lock and never observe a partly
 * applied batch. When a directory is given, accepted readings are also appended to
 * {@code <directory>/<city>.jsonl} and reloaded on construction.
 */
public class TimeSeriesStore implements ReadingStore {
    private static final Logger LOGGER = Logger.getLogger(TimeSeriesStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final String EXTENSION = ".jsonl";

    private final AqiClassifier classifier;
    private final Path directory;
    private final Map<String, CitySeries> series = new ConcurrentHashMap<>();

    public TimeSeriesStore(AqiClassifier classifier) {
        this(classifier, null);
    }

    public TimeSeriesStore(AqiClassifier classifier, Path directory) {
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
        this.directory = directory;
        loadIfPresent();
    }

    @Override
    public AppendResult append(String city, List<SensorReading> readings) {
        Objects.requireNonNull(city, "city is required");
        CitySeries target = series.computeIfAbsent(city, ignored -> new CitySeries());
        target.lock.lock();
        try {
            NavigableMap<Instant, SensorReading> current = target.snapshot;
            TreeMap<Instant, SensorReading> next = null;
            List<SensorReading> accepted = new ArrayList<>();
            int duplicates = 0;
            int rejected = 0;
            for (SensorReading reading : readings) {
                if (!isAcceptable(city, reading)) {
                    rejected++;
                    continue;
                }
                NavigableMap<Instant, SensorReading> view = next == null ? current : next;
                if (view.containsKey(reading.timestamp())) {
                    duplicates++;
                    continue;
                }
                if (next == null) {
                    next = new TreeMap<>(current);
                }
                next.put(reading.timestamp(), reading);
                accepted.add(reading);
            }
            if (next != null) {
                persist(city, accepted);
                target.snapshot = Collections.unmodifiableNavigableMap(next);
            }
            return new AppendResult(accepted.size(), duplicates, rejected);
        } finally {
            target.lock.unlock();
        }
    }

    @Override
    public List<SensorReading> query(String city, Instant from, Instant to) {
        if (from.isAfter(to)) {
            return List.of();
        }
        return List.copyOf(snapshot(city).subMap(from, true, to, true).values());
    }

    @Override
    public Optional<SensorReading> latest(String city) {
        NavigableMap<Instant, SensorReading> snapshot = snapshot(city);
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.lastEntry().getValue());
    }

    private NavigableMap<Instant, SensorReading> snapshot(String city) {
        CitySeries target = series.get(city);
        return target == null ? Collections.emptyNavigableMap() : target.snapshot;
    }

    private boolean isAcceptable(String city, SensorReading reading) {
        if (!city.equals(reading.city())) {
            LOGGER.warning(() -> "Rejected reading for " + reading.city() + " appended to " + city);
            return false;
        }
        try {
            classifier.classify(reading.pm25());
            return true;
        } catch (ClassificationRangeException e) {
            LOGGER.log(Level.WARNING, "Rejected reading for " + city + " at " + reading.timestamp(), e);
            return false;
        }
    }

    private void persist(String city, List<SensorReading> accepted) {
        if (directory == null) {
            return;
        }
        List<String> lines = new ArrayList<>(accepted.size());
        for (SensorReading reading : accepted) {
            try {
                lines.add(MAPPER.writeValueAsString(reading));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed encoding reading for " + city + " at " + reading.timestamp(), e);
            }
        }
        JsonlFiles.append(fileFor(city), lines);
    }

    private void loadIfPresent() {
        if (directory == null || !Files.isDirectory(directory)) {
            return;
        }
        Map<String, TreeMap<Instant, SensorReading>> loaded = new TreeMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                load(file, loaded);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading series from " + directory, e);
        }
        for (Map.Entry<String, TreeMap<Instant, SensorReading>> entry : loaded.entrySet()) {
            CitySeries target = new CitySeries();
            target.snapshot = Collections.unmodifiableNavigableMap(entry.getValue());
            series.put(entry.getKey(), target);
            LOGGER.info(() -> "Loaded " + entry.getValue().size() + " readings for " + entry.getKey());
        }
    }

    private static void load(Path file, Map<String, TreeMap<Instant, SensorReading>> loaded) {
        JsonlFiles.forEachLine(file, (lineNumber, line) -> {
            SensorReading reading;
            try {
                reading = MAPPER.readValue(line, SensorReading.class);
            } catch (IOException decodeError) {
                throw new IllegalStateException("Invalid series line " + lineNumber + " in " + file, decodeError);
            }
            loaded.computeIfAbsent(reading.city(), ignored -> new TreeMap<>())
                    .putIfAbsent(reading.timestamp(), reading);
        });
    }

    private Path fileFor(String city) {
        String slug = city.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return directory.resolve(slug + EXTENSION);
    }

    private static final class CitySeries {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile NavigableMap<Instant, SensorReading> snapshot = Collections.emptyNavigableMap();
    }
}
