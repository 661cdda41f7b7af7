package com.airsentinel.service.store;

import com.airsentinel.core.aqi.AqiClassifier;
import com.airsentinel.core.model.SensorReading;
import com.airsentinel.ingest.api.AppendResult;
import com.airsentinel.service.support.TestReadings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.airsentinel.service.support.TestReadings.T0;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeSeriesStoreTest {
    @TempDir
    Path tempDir;

    @Test
    void reingestingTheSameBatchIsIdempotent() {
        TimeSeriesStore store = new TimeSeriesStore(new AqiClassifier());
        List<SensorReading> batch = TestReadings.hourly("Lahore", 48, 60.0);

        AppendResult first = store.append("Lahore", batch);
        AppendResult second = store.append("Lahore", batch);

        assertEquals(new AppendResult(48, 0, 0), first);
        assertEquals(new AppendResult(0, 48, 0), second);
        assertEquals(48, everything(store, "Lahore").size());
    }

    @Test
    void overlappingBatchKeepsTheFirstValueForATimestamp() {
        TimeSeriesStore store = new TimeSeriesStore(new AqiClassifier());
        store.append("Lahore", TestReadings.hourly("Lahore", T0, 10, i -> 50.0));

        AppendResult result = store.append("Lahore", TestReadings.hourly("Lahore", T0.plus(Duration.ofHours(5)), 10, i -> 99.0));

        assertEquals(5, result.added());
        assertEquals(5, result.duplicates());
        assertEquals(50.0, store.query("Lahore", T0.plus(Duration.ofHours(7)), T0.plus(Duration.ofHours(7))).get(0).pm25());
        assertEquals(99.0, store.latest("Lahore").orElseThrow().pm25());
    }

    @Test
    void invalidReadingsAreRejectedIndividually() {
        TimeSeriesStore store = new TimeSeriesStore(new AqiClassifier());
        List<SensorReading> batch = new ArrayList<>(TestReadings.hourly("Karachi", 5, 40.0));
        batch.add(new SensorReading("Karachi", "k", T0.plus(Duration.ofHours(10)), -2.0));
        batch.add(new SensorReading("Karachi", "k", T0.plus(Duration.ofHours(11)), Double.NaN));
        batch.add(new SensorReading("Karachi", "k", T0.plus(Duration.ofHours(12)), Double.POSITIVE_INFINITY));
        batch.add(new SensorReading("Lahore", "l", T0.plus(Duration.ofHours(13)), 10.0));
        batch.add(new SensorReading("Karachi", "k", T0.plus(Duration.ofHours(14)), 700.0));

        AppendResult result = store.append("Karachi", batch);

        assertEquals(new AppendResult(6, 0, 4), result);
        assertEquals(T0.plus(Duration.ofHours(14)), store.latest("Karachi").orElseThrow().timestamp());
        assertEquals(0, everything(store, "Lahore").size());
    }

    @Test
    void queryIsInclusiveAndAscending() {
        TimeSeriesStore store = new TimeSeriesStore(new AqiClassifier());
        List<SensorReading> batch = new ArrayList<>(TestReadings.hourly("Lahore", 24, 30.0));
        Collections.reverse(batch);
        store.append("Lahore", batch);

        List<SensorReading> window = store.query("Lahore", T0.plus(Duration.ofHours(2)), T0.plus(Duration.ofHours(5)));

        assertEquals(4, window.size());
        assertEquals(T0.plus(Duration.ofHours(2)), window.get(0).timestamp());
        assertEquals(T0.plus(Duration.ofHours(5)), window.get(3).timestamp());
        assertTrue(store.query("Lahore", T0.plus(Duration.ofHours(5)), T0).isEmpty());
        assertTrue(store.query("Quetta", T0, T0.plus(Duration.ofDays(1))).isEmpty());
        assertTrue(store.latest("Quetta").isEmpty());
    }

    @Test
    void batchWithOnlyRejectedReadingsLeavesTheCityEmpty() {
        TimeSeriesStore store = new TimeSeriesStore(new AqiClassifier());
        store.append("Peshawar", TestReadings.hourly("Peshawar", 2, 20.0));
        AppendResult result = store.append("Karachi", List.of(new SensorReading("Karachi", "k", T0, -1.0)));

        assertEquals(1, result.rejected());
        assertTrue(everything(store, "Karachi").isEmpty());
        assertTrue(store.latest("Karachi").isEmpty());
        assertEquals(2, everything(store, "Peshawar").size());
    }

    @Test
    void readersNeverSeeAPartialBatch() throws Exception {
        TimeSeriesStore store = new TimeSeriesStore(new AqiClassifier());
        int batchSize = 100;
        int batches = 40;
        ExecutorService pool = Executors.newFixedThreadPool(3);
        AtomicBoolean torn = new AtomicBoolean(false);
        CountDownLatch writerDone = new CountDownLatch(1);
        try {
            Future<?> writer = pool.submit(() -> {
                for (int b = 0; b < batches; b++) {
                    store.append("Lahore", TestReadings.hourly("Lahore", T0.plus(Duration.ofHours((long) b * batchSize)), batchSize, i -> 25.0));
                }
                writerDone.countDown();
            });
            List<Future<?>> readers = new ArrayList<>();
            for (int r = 0; r < 2; r++) {
                readers.add(pool.submit(() -> {
                    while (writerDone.getCount() > 0) {
                        int size = everything(store, "Lahore").size();
                        if (size % batchSize != 0) {
                            torn.set(true);
                        }
                    }
                }));
            }
            writer.get(10, TimeUnit.SECONDS);
            for (Future<?> reader : readers) {
                reader.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(batchSize * batches, everything(store, "Lahore").size());
        assertFalse(torn.get(), "reader observed a partially applied batch");
    }

    @Test
    void concurrentWritersToOneCityLoseNothing() throws Exception {
        TimeSeriesStore store = new TimeSeriesStore(new AqiClassifier());
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<AppendResult>> results = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                Instant start = T0.plus(Duration.ofHours(w * 50L));
                results.add(pool.submit(() -> store.append("Karachi", TestReadings.hourly("Karachi", start, 100, i -> 30.0))));
            }
            int added = 0;
            for (Future<AppendResult> result : results) {
                added += result.get(10, TimeUnit.SECONDS).added();
            }
            assertEquals(250, added);
            assertEquals(250, everything(store, "Karachi").size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void persistedSeriesIsReloaded() throws Exception {
        Path dir = tempDir.resolve("series");
        TimeSeriesStore store = new TimeSeriesStore(new AqiClassifier(), dir);
        store.append("Lahore", TestReadings.hourly("Lahore", 30, 70.0));
        store.append("Lahore", TestReadings.hourly("Lahore", 30, 70.0));
        store.append("Karachi", TestReadings.hourly("Karachi", 3, 15.0));

        assertEquals(30, Files.readAllLines(dir.resolve("lahore.jsonl")).size());

        TimeSeriesStore reloaded = new TimeSeriesStore(new AqiClassifier(), dir);
        assertEquals(30, everything(reloaded, "Lahore").size());
        assertEquals(3, everything(reloaded, "Karachi").size());
        assertEquals(store.latest("Lahore"), reloaded.latest("Lahore"));
        assertEquals(0, reloaded.append("Lahore", TestReadings.hourly("Lahore", 30, 70.0)).added());
    }

    private static List<SensorReading> everything(TimeSeriesStore store, String city) {
        return store.query(city, Instant.MIN, Instant.MAX);
    }
}
