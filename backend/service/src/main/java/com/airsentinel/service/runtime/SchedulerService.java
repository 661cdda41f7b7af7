package com.airsentinel.service.runtime;

import com.airsentinel.core.events.JobCompleted;
import com.airsentinel.ingest.api.Collector;
import com.airsentinel.ingest.api.CollectorContext;
import com.airsentinel.ingest.api.CollectorResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs each enabled collector at its own fixed rate. A run that throws is logged and reported as
 * a failed job; it never cancels later runs.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final List<ScheduledCollector> collectors;
    private final CollectorContext context;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService collectorExecutor = Executors.newCachedThreadPool();

    public SchedulerService(List<ScheduledCollector> collectors, CollectorContext context) {
        this(collectors, context, 100);
    }

    SchedulerService(List<ScheduledCollector> collectors, CollectorContext context, long minIntervalMillis) {
        this.collectors = List.copyOf(collectors);
        this.context = context;
        this.minIntervalMillis = minIntervalMillis;
    }

    /**
     * Schedules every enabled collector at its interval, first run one interval from now. Callers
     * warm up through {@link #runOnceInOrder()} beforehand.
     */
    public void startDeferred() {
        for (ScheduledCollector scheduled : collectors) {
            if (!scheduled.enabled()) {
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> collectorExecutor.submit(() -> runCollectorSafely(scheduled.collector())),
                    intervalMillis,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
            LOGGER.info(() -> "Scheduled " + scheduled.collector().name() + " every " + intervalMillis + "ms");
        }
    }

    /**
     * Runs the enabled collectors one after another, in registration order.
     */
    public List<CollectorResult> runOnceInOrder() {
        List<CollectorResult> results = new ArrayList<>();
        for (ScheduledCollector scheduled : collectors) {
            if (scheduled.enabled()) {
                results.add(runCollectorSafely(scheduled.collector()));
            }
        }
        return results;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        collectorExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            collectorExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private CollectorResult runCollectorSafely(Collector collector) {
        try {
            return collector.poll(context).join();
        } catch (Exception ex) {
            LOGGER.log(Level.SEVERE, "Collector run failed: " + collector.name(), ex);
            context.eventBus().publish(new JobCompleted(context.clock().instant(), collector.name(), false, 0));
            return CollectorResult.failure(
                    "Collector run failed: " + collector.name(),
                    Map.of("collector", collector.name())
            );
        }
    }

    public record ScheduledCollector(Collector collector, Duration interval, boolean enabled) {
        public ScheduledCollector {
            Objects.requireNonNull(collector, "collector is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }
}
