package com.airsentinel.ingest.fetch;

import com.airsentinel.core.model.CitySource;
import com.airsentinel.core.model.SensorReading;
import com.airsentinel.ingest.api.MeasurementPage;
import com.airsentinel.ingest.api.MeasurementProvider;
import com.airsentinel.ingest.api.PageRequest;
import com.airsentinel.ingest.error.IngestionFailedException;
import com.airsentinel.ingest.error.SchemaMismatchException;
import com.airsentinel.ingest.error.TransientProviderException;
import com.airsentinel.ingest.retry.RetryPolicy;
import io.github.resilience4j.retry.MaxRetriesExceededException;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Pages through the provider for one city over a bounded window.
 *
 * <p>The cursor is the hour of the last row of the previous page; the next request starts
 * one hour after it. Paging stops on a short page or once the cursor passes the window end, so a
 * window holding R rows costs {@code ceil(R / pageSize)} requests. Cities with several sensors are
 * paged sensor by sensor. Rows of one page that fall in the same hour are averaged into one
 * reading. A city configured without sensors has them looked up through the provider once and
 * remembered. No deduplication happens here.
 */
public final class ReadingFetcher {
    private static final Logger LOGGER = Logger.getLogger(ReadingFetcher.class.getName());
    private static final Duration CURSOR_STEP = Duration.ofHours(1);

    private final MeasurementProvider provider;
    private final RetryPolicy retryPolicy;
    private final int pageSize;
    private final Map<String, CitySource> cities;
    private final Map<String, List<String>> discoveredSensors = new ConcurrentHashMap<>();

    public ReadingFetcher(MeasurementProvider provider, RetryPolicy retryPolicy, int pageSize, List<CitySource> cities) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.pageSize = pageSize;
        Map<String, CitySource> byName = new LinkedHashMap<>();
        for (CitySource city : cities) {
            byName.put(city.name(), city);
        }
        this.cities = Map.copyOf(byName);
    }

    /**
     * Lazy view over the window. Nothing is requested until iteration starts, and every call to
     * {@link Iterable#iterator()} starts over from {@code windowStart}.
     */
    public Iterable<SensorReading> fetch(String city, Instant windowStart, Instant windowEnd) {
        CitySource source = cities.get(city);
        if (source == null) {
            throw new IllegalArgumentException("City is not configured for ingestion: " + city);
        }
        Objects.requireNonNull(windowStart, "windowStart is required");
        Objects.requireNonNull(windowEnd, "windowEnd is required");
        return () -> new PagingIterator(source, windowStart, windowEnd);
    }

    /**
     * Continues an interrupted fetch. Overlap with already stored rows is harmless.
     */
    public Iterable<SensorReading> resumeFrom(String city, Instant cursor, Instant windowEnd) {
        return fetch(city, cursor, windowEnd);
    }

    public List<SensorReading> fetchAll(String city, Instant windowStart, Instant windowEnd) {
        List<SensorReading> readings = new ArrayList<>();
        for (SensorReading reading : fetch(city, windowStart, windowEnd)) {
            readings.add(reading);
        }
        return readings;
    }

    public int pageSize() {
        return pageSize;
    }

    private MeasurementPage requestPage(String city, PageRequest request) {
        return call(city, "Fetch " + city + "/" + request.sensorId() + " from " + request.from(),
                () -> provider.fetchPage(request));
    }

    private List<String> sensorsFor(CitySource source) {
        if (!source.sensorIds().isEmpty()) {
            return source.sensorIds();
        }
        List<String> known = discoveredSensors.get(source.name());
        if (known != null) {
            return known;
        }
        String city = source.name();
        List<String> found = List.copyOf(call(city, "Sensor lookup for " + city, () -> provider.discoverSensors(city)));
        if (found.isEmpty()) {
            throw new IngestionFailedException(city, "no PM2.5 sensors found", null);
        }
        LOGGER.info(() -> "Discovered PM2.5 sensors for " + city + ": " + found);
        discoveredSensors.put(city, found);
        return found;
    }

    private <T> T call(String city, String operation, Supplier<T> action) {
        try {
            return retryPolicy.execute(action);
        } catch (SchemaMismatchException e) {
            throw new SchemaMismatchException(operation + " rejected: " + e.getMessage(), e);
        } catch (TransientProviderException | MaxRetriesExceededException e) {
            throw new IngestionFailedException(city,
                    operation + " failed after " + retryPolicy.maxAttempts() + " attempts: " + e.getMessage(), e);
        } catch (IngestionFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IngestionFailedException(city, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
        }
    }

    private final class PagingIterator implements Iterator<SensorReading> {
        private final CitySource source;
        private final String city;
        private final Instant windowStart;
        private final Instant windowEnd;
        private final Deque<SensorReading> buffer = new ArrayDeque<>();

        private Deque<String> pendingSensors;
        private String sensorId;
        private Instant cursor;
        private boolean sensorExhausted = true;

        private PagingIterator(CitySource source, Instant windowStart, Instant windowEnd) {
            this.source = source;
            this.city = source.name();
            this.windowStart = windowStart;
            this.windowEnd = windowEnd;
        }

        @Override
        public boolean hasNext() {
            if (pendingSensors == null) {
                pendingSensors = windowStart.isAfter(windowEnd) ? new ArrayDeque<>() : new ArrayDeque<>(sensorsFor(source));
            }
            while (buffer.isEmpty()) {
                if (sensorExhausted) {
                    if (pendingSensors.isEmpty()) {
                        return false;
                    }
                    sensorId = pendingSensors.pollFirst();
                    cursor = windowStart;
                    sensorExhausted = cursor.isAfter(windowEnd);
                    continue;
                }
                loadNextPage();
            }
            return true;
        }

        @Override
        public SensorReading next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.pollFirst();
        }

        private void loadNextPage() {
            MeasurementPage page = requestPage(city, new PageRequest(sensorId, cursor, windowEnd, pageSize));
            Map<Instant, double[]> hours = new LinkedHashMap<>();
            for (MeasurementPage.Row row : page.rows()) {
                double[] acc = hours.computeIfAbsent(row.periodStart().truncatedTo(ChronoUnit.HOURS),
                        ignored -> new double[] {0.0, 0.0, row.value()});
                if (Double.isFinite(row.value()) && row.value() >= 0.0) {
                    acc[0] += row.value();
                    acc[1]++;
                }
            }
            for (Map.Entry<Instant, double[]> hour : hours.entrySet()) {
                double[] acc = hour.getValue();
                // an hour with no usable value keeps its first raw value so the store rejects it
                double value = acc[1] == 0.0 ? acc[2] : acc[0] / acc[1];
                buffer.addLast(new SensorReading(city, sensorId, hour.getKey(), value));
            }
            if (page.size() < pageSize) {
                sensorExhausted = true;
                return;
            }
            Instant next = page.lastTimestamp().truncatedTo(ChronoUnit.HOURS).plus(CURSOR_STEP);
            if (!next.isAfter(cursor)) {
                throw new SchemaMismatchException("Provider page for " + city + " sensor " + sensorId
                        + " did not advance past cursor " + cursor);
            }
            cursor = next;
            if (cursor.isAfter(windowEnd)) {
                sensorExhausted = true;
            }
            LOGGER.fine(() -> "Advancing " + city + "/" + sensorId + " cursor to " + cursor);
        }
    }
}
