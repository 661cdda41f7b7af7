package com.airsentinel.ingest.api;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * A periodic pipeline job. Implementations report their own failures through the returned
 * {@link CollectorResult} and the event bus; the future completes exceptionally only on bugs.
 */
public interface Collector {
    String name();

    Duration interval();

    CompletableFuture<CollectorResult> poll(CollectorContext ctx);
}
