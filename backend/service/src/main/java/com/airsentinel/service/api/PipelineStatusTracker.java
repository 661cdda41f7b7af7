package com.airsentinel.service.api;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.CityIngested;
import com.airsentinel.core.events.CityIngestionFailed;
import com.airsentinel.core.events.Event;
import com.airsentinel.core.events.JobCompleted;
import com.airsentinel.core.events.JobStarted;
import com.airsentinel.core.events.ModelPublished;
import com.airsentinel.core.events.TrainingFailed;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Last known state of each job and each city, folded from the event bus.
 */
public final class PipelineStatusTracker {
    private final LongAdder eventsTotal = new LongAdder();
    private final ConcurrentHashMap<String, JobStatus> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CityStatus> cities = new ConcurrentHashMap<>();

    public PipelineStatusTracker(EventBus eventBus) {
        eventBus.subscribeAll(this::onAnyEvent);
        eventBus.subscribe(JobStarted.class, this::onJobStarted);
        eventBus.subscribe(JobCompleted.class, this::onJobCompleted);
        eventBus.subscribe(CityIngested.class, this::onCityIngested);
        eventBus.subscribe(CityIngestionFailed.class, this::onCityIngestionFailed);
        eventBus.subscribe(ModelPublished.class, this::onModelPublished);
        eventBus.subscribe(TrainingFailed.class, this::onTrainingFailed);
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new HashMap<>();
        snapshot.put("eventsTotal", eventsTotal.longValue());
        snapshot.put("jobs", jobsSnapshot());
        snapshot.put("cities", citiesSnapshot());
        return snapshot;
    }

    public Map<String, Object> jobsSnapshot() {
        Map<String, Object> view = new TreeMap<>();
        jobs.forEach((name, status) -> view.put(name, status.toMap()));
        return view;
    }

    public Map<String, Object> citiesSnapshot() {
        Map<String, Object> view = new TreeMap<>();
        cities.forEach((name, status) -> view.put(name, status.toMap()));
        return view;
    }

    private void onAnyEvent(Event event) {
        eventsTotal.increment();
    }

    private void onJobStarted(JobStarted event) {
        jobs.compute(event.jobName(), (name, current) -> job(current).withLastRunAt(event.timestamp()));
    }

    private void onJobCompleted(JobCompleted event) {
        jobs.compute(event.jobName(), (name, current) ->
                job(current).withCompletion(event.timestamp(), event.durationMillis(), event.success()));
    }

    private void onCityIngested(CityIngested event) {
        cities.compute(event.city(), (name, current) -> city(current).withIngestion(event.timestamp(), event.added()));
    }

    private void onCityIngestionFailed(CityIngestionFailed event) {
        cities.compute(event.city(), (name, current) ->
                city(current).withIngestionError(event.code() + ": " + event.message()));
    }

    private void onModelPublished(ModelPublished event) {
        cities.compute(event.city(), (name, current) -> city(current).withTraining(event.trainedAt()));
    }

    private void onTrainingFailed(TrainingFailed event) {
        cities.compute(event.city(), (name, current) -> city(current).withTrainingError(event.message()));
    }

    private static JobStatus job(JobStatus current) {
        return current == null ? new JobStatus(null, null, null) : current;
    }

    private static CityStatus city(CityStatus current) {
        return current == null ? new CityStatus(null, null, null, null, null) : current;
    }

    private record JobStatus(Instant lastRunAt, Long lastDurationMillis, Boolean lastSuccess) {
        private JobStatus withLastRunAt(Instant runAt) {
            return new JobStatus(runAt, lastDurationMillis, lastSuccess);
        }

        private JobStatus withCompletion(Instant completedAt, long durationMillis, boolean success) {
            return new JobStatus(completedAt, durationMillis, success);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastRunAt", lastRunAt == null ? null : lastRunAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            return map;
        }
    }

    private record CityStatus(
            Instant lastIngestedAt,
            Integer lastReadingsAdded,
            String lastIngestionError,
            Instant lastTrainedAt,
            String lastTrainingError
    ) {
        private CityStatus withIngestion(Instant at, int added) {
            return new CityStatus(at, added, null, lastTrainedAt, lastTrainingError);
        }

        private CityStatus withIngestionError(String message) {
            return new CityStatus(lastIngestedAt, lastReadingsAdded, message, lastTrainedAt, lastTrainingError);
        }

        private CityStatus withTraining(Instant trainedAt) {
            return new CityStatus(lastIngestedAt, lastReadingsAdded, lastIngestionError, trainedAt, null);
        }

        private CityStatus withTrainingError(String message) {
            return new CityStatus(lastIngestedAt, lastReadingsAdded, lastIngestionError, lastTrainedAt, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("lastIngestedAt", lastIngestedAt == null ? null : lastIngestedAt.toString());
            map.put("lastReadingsAdded", lastReadingsAdded);
            map.put("lastIngestionError", lastIngestionError);
            map.put("lastTrainedAt", lastTrainedAt == null ? null : lastTrainedAt.toString());
            map.put("lastTrainingError", lastTrainingError);
            return map;
        }
    }
}
