package com.airsentinel.ingest.collector;

import com.airsentinel.core.error.AirSentinelException;
import com.airsentinel.core.events.CityIngested;
import com.airsentinel.core.events.CityIngestionFailed;
import com.airsentinel.core.events.JobCompleted;
import com.airsentinel.core.events.JobStarted;
import com.airsentinel.core.model.SensorReading;
import com.airsentinel.ingest.api.AppendResult;
import com.airsentinel.ingest.api.Collector;
import com.airsentinel.ingest.api.CollectorContext;
import com.airsentinel.ingest.api.CollectorResult;
import com.airsentinel.ingest.config.IngestionConfig;
import com.airsentinel.ingest.fetch.ReadingFetcher;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs fetch-then-append for every configured city. Cities run in parallel on the supplied
 * executor; a failure in one city is reported for that city only.
 *
 * <p>A city with stored data resumes one hour after its latest reading; an empty city is
 * backfilled over {@link IngestionConfig#historyDays()}.
 */
public class AirQualityCollector implements Collector {
    private static final Logger LOGGER = Logger.getLogger(AirQualityCollector.class.getName());

    private final ReadingFetcher fetcher;
    private final List<String> cities;
    private final IngestionConfig config;
    private final Executor executor;

    public AirQualityCollector(ReadingFetcher fetcher, List<String> cities, IngestionConfig config, Executor executor) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.cities = List.copyOf(cities);
        this.config = Objects.requireNonNull(config, "config is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
    }

    @Override
    public String name() {
        return "ingestion";
    }

    @Override
    public Duration interval() {
        return config.interval();
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new JobStarted(startedAt, name()));

        List<CompletableFuture<CityOutcome>> tasks = new ArrayList<>();
        for (String city : cities) {
            tasks.add(CompletableFuture.supplyAsync(() -> ingestAndReport(city, ctx), executor));
        }

        return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> summarize(tasks.stream().map(CompletableFuture::join).toList()))
                .handle((result, error) -> {
                    long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
                    if (error != null) {
                        LOGGER.log(Level.SEVERE, "Ingestion run failed", error);
                        ctx.eventBus().publish(new JobCompleted(ctx.clock().instant(), name(), false, durationMillis));
                        return CollectorResult.failure("Ingestion failed: " + rootMessage(error), Map.of());
                    }
                    ctx.eventBus().publish(new JobCompleted(ctx.clock().instant(), name(), result.success(), durationMillis));
                    return result;
                });
    }

    /**
     * Fetches and stores one city's pending window. Typed failures propagate to the caller.
     */
    public AppendResult ingestCity(String city, CollectorContext ctx) {
        Instant windowEnd = ctx.clock().instant().truncatedTo(ChronoUnit.HOURS);
        Instant windowStart = windowStartFor(city, ctx, windowEnd);
        if (windowStart.isAfter(windowEnd)) {
            return AppendResult.empty();
        }
        List<SensorReading> readings = fetcher.fetchAll(city, windowStart, windowEnd);
        AppendResult result = ctx.readingStore().append(city, readings);
        LOGGER.info(() -> "Ingested " + city + " [" + windowStart + ", " + windowEnd + "]: fetched=" + readings.size()
                + " added=" + result.added() + " duplicates=" + result.duplicates() + " rejected=" + result.rejected());
        return result;
    }

    private Instant windowStartFor(String city, CollectorContext ctx, Instant windowEnd) {
        Optional<SensorReading> latest = ctx.readingStore().latest(city);
        if (latest.isPresent()) {
            return latest.get().timestamp().plus(1, ChronoUnit.HOURS);
        }
        return windowEnd.minus(config.historyDays(), ChronoUnit.DAYS);
    }

    private CityOutcome ingestAndReport(String city, CollectorContext ctx) {
        try {
            AppendResult result = ingestCity(city, ctx);
            ctx.eventBus().publish(new CityIngested(
                    ctx.clock().instant(),
                    city,
                    result.total(),
                    result.added(),
                    result.duplicates(),
                    result.rejected()
            ));
            return new CityOutcome(city, true, result.added());
        } catch (RuntimeException e) {
            String code = e instanceof AirSentinelException typed ? typed.code() : "ingestion_failed";
            String message = e.getMessage() == null ? rootMessage(e) : e.getMessage();
            LOGGER.log(Level.WARNING, "Ingestion failed for " + city + " (" + code + ")", e);
            ctx.eventBus().publish(new CityIngestionFailed(ctx.clock().instant(), city, code, message));
            return new CityOutcome(city, false, 0);
        }
    }

    private CollectorResult summarize(List<CityOutcome> outcomes) {
        List<String> failed = new ArrayList<>();
        int added = 0;
        for (CityOutcome outcome : outcomes) {
            if (outcome.success()) {
                added += outcome.added();
            } else {
                failed.add(outcome.city());
            }
        }

        Map<String, Object> stats = new HashMap<>();
        stats.put("cities", cities);
        stats.put("successes", outcomes.size() - failed.size());
        stats.put("failedCities", failed);
        stats.put("readingsAdded", added);
        if (failed.isEmpty()) {
            return CollectorResult.success("Ingestion completed", stats);
        }
        return CollectorResult.failure("Ingestion had failures", stats);
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private record CityOutcome(String city, boolean success, int added) {
    }
}
