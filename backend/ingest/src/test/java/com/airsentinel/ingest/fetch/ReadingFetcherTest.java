package com.airsentinel.ingest.fetch;

import com.airsentinel.core.model.CitySource;
import com.airsentinel.core.model.SensorReading;
import com.airsentinel.ingest.api.MeasurementPage;
import com.airsentinel.ingest.api.MeasurementProvider;
import com.airsentinel.ingest.api.PageRequest;
import com.airsentinel.ingest.config.RetrySettings;
import com.airsentinel.ingest.error.IngestionFailedException;
import com.airsentinel.ingest.error.SchemaMismatchException;
import com.airsentinel.ingest.error.TransientProviderException;
import com.airsentinel.ingest.retry.RetryPolicy;
import com.airsentinel.ingest.support.HourlyProvider;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReadingFetcherTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final List<CitySource> CITIES = List.of(
            new CitySource("Lahore", List.of("8118")),
            new CitySource("Karachi", List.of("k-1", "k-2"))
    );

    @Test
    void paginatesNinetyDaysInThreeRequests() {
        HourlyProvider provider = new HourlyProvider(T0, 2160);
        ReadingFetcher fetcher = new ReadingFetcher(provider, RetryPolicy.noRetry(), 1000, CITIES);

        List<SensorReading> readings = fetcher.fetchAll("Lahore", T0, T0.plus(Duration.ofHours(2159)));

        assertEquals(2160, readings.size());
        assertEquals(3, provider.requestCount());
        List<PageRequest> requests = provider.requests();
        assertEquals(T0, requests.get(0).from());
        assertEquals(T0.plus(Duration.ofHours(1000)), requests.get(1).from());
        assertEquals(T0.plus(Duration.ofHours(2000)), requests.get(2).from());
        assertTrue(requests.stream().allMatch(request -> request.limit() == 1000));
        for (int i = 1; i < readings.size(); i++) {
            assertTrue(readings.get(i).timestamp().isAfter(readings.get(i - 1).timestamp()));
        }
    }

    @Test
    void exactMultipleOfPageSizeNeedsOneTrailingEmptyRequest() {
        HourlyProvider provider = new HourlyProvider(T0, 2000);
        ReadingFetcher fetcher = new ReadingFetcher(provider, RetryPolicy.noRetry(), 1000, CITIES);

        List<SensorReading> readings = fetcher.fetchAll("Lahore", T0, T0.plus(Duration.ofDays(100)));

        assertEquals(2000, readings.size());
        assertEquals(3, provider.requestCount());
    }

    @Test
    void stopsOnceCursorPassesWindowEnd() {
        HourlyProvider provider = new HourlyProvider(T0, 2000);
        ReadingFetcher fetcher = new ReadingFetcher(provider, RetryPolicy.noRetry(), 1000, CITIES);

        List<SensorReading> readings = fetcher.fetchAll("Lahore", T0, T0.plus(Duration.ofHours(1999)));

        assertEquals(2000, readings.size());
        assertEquals(2, provider.requestCount());
    }

    @Test
    void fetchIsLazyAndRestartable() {
        HourlyProvider provider = new HourlyProvider(T0, 30);
        ReadingFetcher fetcher = new ReadingFetcher(provider, RetryPolicy.noRetry(), 10, CITIES);

        Iterable<SensorReading> view = fetcher.fetch("Lahore", T0, T0.plus(Duration.ofHours(29)));
        assertEquals(0, provider.requestCount());

        Iterator<SensorReading> iterator = view.iterator();
        assertEquals(0, provider.requestCount());
        assertEquals(T0, iterator.next().timestamp());
        assertEquals(1, provider.requestCount());

        int count = 0;
        for (SensorReading ignored : view) {
            count++;
        }
        assertEquals(30, count);
        assertEquals(T0, provider.requests().get(1).from());
    }

    @Test
    void resumeStartsFromTheGivenCursor() {
        HourlyProvider provider = new HourlyProvider(T0, 48);
        ReadingFetcher fetcher = new ReadingFetcher(provider, RetryPolicy.noRetry(), 1000, CITIES);

        Instant cursor = T0.plus(Duration.ofHours(40));
        int count = 0;
        for (SensorReading reading : fetcher.resumeFrom("Lahore", cursor, T0.plus(Duration.ofHours(47)))) {
            assertFalse(reading.timestamp().isBefore(cursor));
            count++;
        }
        assertEquals(8, count);
    }

    @Test
    void readingsAreTruncatedToTheHourAndTaggedWithCityAndSensor() {
        ReadingFetcher fetcher = new ReadingFetcher(request -> new MeasurementPage(List.of(
                new MeasurementPage.Row(T0.plus(Duration.ofMinutes(30)), 12.5),
                new MeasurementPage.Row(T0.plus(Duration.ofMinutes(95)), 13.5)
        )), RetryPolicy.noRetry(), 1000, CITIES);

        List<SensorReading> readings = fetcher.fetchAll("Lahore", T0, T0.plus(Duration.ofHours(3)));

        assertEquals(List.of(
                new SensorReading("Lahore", "8118", T0, 12.5),
                new SensorReading("Lahore", "8118", T0.plus(Duration.ofHours(1)), 13.5)
        ), readings);
    }

    @Test
    void subHourlySamplesAreAveragedIntoOneReadingPerHour() {
        List<MeasurementPage.Row> rows = new ArrayList<>();
        for (int hour = 0; hour < 3; hour++) {
            for (int quarter = 0; quarter < 4; quarter++) {
                rows.add(new MeasurementPage.Row(T0.plus(Duration.ofHours(hour)).plus(Duration.ofMinutes(15L * quarter)), 40.0 * quarter));
            }
        }
        ReadingFetcher fetcher = new ReadingFetcher(request -> new MeasurementPage(rows), RetryPolicy.noRetry(), 1000, CITIES);

        List<SensorReading> readings = fetcher.fetchAll("Lahore", T0, T0.plus(Duration.ofHours(2)));

        assertEquals(List.of(
                new SensorReading("Lahore", "8118", T0, 60.0),
                new SensorReading("Lahore", "8118", T0.plus(Duration.ofHours(1)), 60.0),
                new SensorReading("Lahore", "8118", T0.plus(Duration.ofHours(2)), 60.0)
        ), readings);
    }

    @Test
    void invalidSamplesAreLeftOutOfTheHourlyMean() {
        ReadingFetcher fetcher = new ReadingFetcher(request -> new MeasurementPage(List.of(
                new MeasurementPage.Row(T0, 30.0),
                new MeasurementPage.Row(T0.plus(Duration.ofMinutes(30)), -999.0),
                new MeasurementPage.Row(T0.plus(Duration.ofMinutes(45)), 50.0),
                new MeasurementPage.Row(T0.plus(Duration.ofHours(1)), -1.0)
        )), RetryPolicy.noRetry(), 1000, CITIES);

        List<SensorReading> readings = fetcher.fetchAll("Lahore", T0, T0.plus(Duration.ofHours(1)));

        assertEquals(2, readings.size());
        assertEquals(40.0, readings.get(0).pm25());
        assertEquals(-1.0, readings.get(1).pm25());
    }

    @Test
    void cityWithoutConfiguredSensorsIsLookedUpOnce() {
        HourlyProvider pages = new HourlyProvider(T0, 5);
        AtomicInteger lookups = new AtomicInteger();
        MeasurementProvider provider = new MeasurementProvider() {
            @Override
            public MeasurementPage fetchPage(PageRequest request) {
                return pages.fetchPage(request);
            }

            @Override
            public List<String> discoverSensors(String city) {
                lookups.incrementAndGet();
                return "Multan".equals(city) ? List.of("m-1", "m-2") : List.of();
            }
        };
        List<CitySource> cities = List.of(new CitySource("Multan", List.of()), new CitySource("Quetta", List.of()));
        ReadingFetcher fetcher = new ReadingFetcher(provider, RetryPolicy.noRetry(), 1000, cities);

        List<SensorReading> first = fetcher.fetchAll("Multan", T0, T0.plus(Duration.ofHours(4)));
        List<SensorReading> second = fetcher.fetchAll("Multan", T0, T0.plus(Duration.ofHours(4)));

        assertEquals(10, first.size());
        assertEquals(first, second);
        assertEquals(1, lookups.get());
        assertEquals(List.of("m-1", "m-2", "m-1", "m-2"), pages.requests().stream().map(PageRequest::sensorId).toList());

        IngestionFailedException error = assertThrows(IngestionFailedException.class,
                () -> fetcher.fetchAll("Quetta", T0, T0.plus(Duration.ofHours(4))));
        assertEquals("Quetta", error.city());
        assertTrue(error.getMessage().contains("no PM2.5 sensors"));
    }

    @Test
    void transientSensorLookupFailureIsRetriedThenReported() {
        AtomicInteger lookups = new AtomicInteger();
        MeasurementProvider provider = new MeasurementProvider() {
            @Override
            public MeasurementPage fetchPage(PageRequest request) {
                throw new AssertionError("no sensors, no pages");
            }

            @Override
            public List<String> discoverSensors(String city) {
                lookups.incrementAndGet();
                throw new TransientProviderException("HTTP 502");
            }
        };
        RetryPolicy retry = new RetryPolicy("test", new RetrySettings(2, Duration.ofMillis(1), Duration.ofMillis(1), 1.0));
        ReadingFetcher fetcher = new ReadingFetcher(provider, retry, 1000, List.of(new CitySource("Multan", List.of())));

        IngestionFailedException error = assertThrows(IngestionFailedException.class,
                () -> fetcher.fetchAll("Multan", T0, T0.plus(Duration.ofHours(4))));

        assertEquals(2, lookups.get());
        assertTrue(error.getMessage().contains("Sensor lookup for Multan"));
    }

    @Test
    void pagesEachSensorOfACityInTurn() {
        HourlyProvider provider = new HourlyProvider(T0, 10);
        ReadingFetcher fetcher = new ReadingFetcher(provider, RetryPolicy.noRetry(), 1000, CITIES);

        List<SensorReading> readings = fetcher.fetchAll("Karachi", T0, T0.plus(Duration.ofHours(9)));

        assertEquals(20, readings.size());
        assertEquals(List.of("k-1", "k-2"), provider.requests().stream().map(PageRequest::sensorId).toList());
        assertTrue(readings.subList(0, 10).stream().allMatch(reading -> "k-1".equals(reading.sensorId())));
        assertTrue(readings.subList(10, 20).stream().allMatch(reading -> "k-2".equals(reading.sensorId())));
    }

    @Test
    void retryExhaustionRaisesIngestionFailedForTheCity() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy retry = new RetryPolicy("test", new RetrySettings(3, Duration.ofMillis(1), Duration.ofMillis(1), 1.0));
        ReadingFetcher fetcher = new ReadingFetcher(request -> {
            calls.incrementAndGet();
            throw new TransientProviderException("HTTP 503");
        }, retry, 1000, CITIES);

        IngestionFailedException error = assertThrows(IngestionFailedException.class,
                () -> fetcher.fetchAll("Lahore", T0, T0.plus(Duration.ofHours(5))));

        assertEquals("Lahore", error.city());
        assertEquals("ingestion_failed", error.code());
        assertEquals(3, calls.get());
        assertInstanceOf(TransientProviderException.class, error.getCause());
        assertTrue(error.getMessage().contains("after 3 attempts"));
    }

    @Test
    void schemaMismatchFailsFastWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy retry = new RetryPolicy("test", RetrySettings.defaults());
        ReadingFetcher fetcher = new ReadingFetcher(request -> {
            calls.incrementAndGet();
            throw new SchemaMismatchException("Response is missing the 'results' array");
        }, retry, 1000, CITIES);

        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> fetcher.fetchAll("Lahore", T0, T0.plus(Duration.ofHours(5))));

        assertEquals(1, calls.get());
        assertEquals("schema_mismatch", error.code());
        assertTrue(error.getMessage().contains("Lahore"));
        assertEquals(0, retry.retry().getMetrics().getNumberOfFailedCallsWithRetryAttempt());
    }

    @Test
    void nonRetryableProviderErrorBecomesIngestionFailure() {
        ReadingFetcher fetcher = new ReadingFetcher(request -> {
            throw new IllegalStateException("OpenAQ request failed with status 401");
        }, RetryPolicy.noRetry(), 1000, CITIES);

        IngestionFailedException error = assertThrows(IngestionFailedException.class,
                () -> fetcher.fetchAll("Lahore", T0, T0.plus(Duration.ofHours(5))));

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertTrue(error.getMessage().contains("401"));
    }

    @Test
    void fullPageThatDoesNotAdvanceTheCursorIsRejected() {
        ReadingFetcher fetcher = new ReadingFetcher(request -> new MeasurementPage(List.of(
                new MeasurementPage.Row(T0.minus(Duration.ofHours(2)), 5.0),
                new MeasurementPage.Row(T0.minus(Duration.ofHours(1)), 6.0)
        )), RetryPolicy.noRetry(), 2, CITIES);

        assertThrows(SchemaMismatchException.class,
                () -> fetcher.fetchAll("Lahore", T0, T0.plus(Duration.ofHours(5))));
    }

    @Test
    void emptyWindowIssuesNoRequests() {
        HourlyProvider provider = new HourlyProvider(T0, 10);
        ReadingFetcher fetcher = new ReadingFetcher(provider, RetryPolicy.noRetry(), 1000, CITIES);

        assertTrue(fetcher.fetchAll("Lahore", T0.plus(Duration.ofHours(5)), T0).isEmpty());
        assertEquals(0, provider.requestCount());
    }

    @Test
    void unknownCityIsRejected() {
        ReadingFetcher fetcher = new ReadingFetcher(new HourlyProvider(T0, 1), RetryPolicy.noRetry(), 1000, CITIES);

        assertThrows(IllegalArgumentException.class, () -> fetcher.fetch("Quetta", T0, T0));
    }
}
