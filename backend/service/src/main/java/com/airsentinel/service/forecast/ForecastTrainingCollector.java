package com.airsentinel.service.forecast;

import com.airsentinel.core.events.JobCompleted;
import com.airsentinel.core.events.JobStarted;
import com.airsentinel.ingest.api.Collector;
import com.airsentinel.ingest.api.CollectorContext;
import com.airsentinel.ingest.api.CollectorResult;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Scheduled retraining of every city, off the request path.
 */
public class ForecastTrainingCollector implements Collector {
    private final ForecastTrainer trainer;
    private final Duration interval;
    private final Executor executor;

    public ForecastTrainingCollector(ForecastTrainer trainer, Duration interval, Executor executor) {
        this.trainer = trainer;
        this.interval = interval;
        this.executor = executor;
    }

    @Override
    public String name() {
        return "training";
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new JobStarted(startedAt, name()));
        return CompletableFuture.supplyAsync(trainer::trainAll, executor)
                .thenApply(summary -> {
                    long durationMillis = Duration.between(startedAt, ctx.clock().instant()).toMillis();
                    ctx.eventBus().publish(new JobCompleted(ctx.clock().instant(), name(), summary.success(), durationMillis));
                    Map<String, Object> stats = new HashMap<>();
                    stats.put("trained", summary.published().size());
                    stats.put("failures", summary.failures());
                    return summary.success()
                            ? CollectorResult.success("Training completed", stats)
                            : CollectorResult.failure("Training had failures", stats);
                });
    }
}
