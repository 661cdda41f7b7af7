package com.airsentinel.service.api;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.CityIngested;
import com.airsentinel.core.events.CityIngestionFailed;
import com.airsentinel.core.events.JobCompleted;
import com.airsentinel.core.events.JobStarted;
import com.airsentinel.core.events.ModelPublished;
import com.airsentinel.core.events.TrainingFailed;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PipelineStatusTrackerTest {
    private static final Instant T = Instant.parse("2026-02-01T00:00:00Z");

    @Test
    void foldsJobAndCityEventsIntoTheLatestState() {
        EventBus bus = new EventBus();
        PipelineStatusTracker tracker = new PipelineStatusTracker(bus);

        bus.publish(new JobStarted(T, "ingestion"));
        bus.publish(new CityIngestionFailed(T.plusSeconds(1), "Peshawar", "schema_mismatch", "missing results"));
        bus.publish(new CityIngested(T.plusSeconds(2), "Lahore", 49, 49, 0, 0));
        bus.publish(new JobCompleted(T.plusSeconds(3), "ingestion", false, 3000));
        bus.publish(new TrainingFailed(T.plusSeconds(4), "Lahore", "not enough history"));
        bus.publish(new ModelPublished(T.plusSeconds(5), "Lahore", T.plusSeconds(5), T.minusSeconds(86_400), T, 49));

        Map<String, Object> snapshot = tracker.snapshot();
        assertEquals(6L, snapshot.get("eventsTotal"));

        Map<?, ?> ingestion = (Map<?, ?>) tracker.jobsSnapshot().get("ingestion");
        assertEquals(T.plusSeconds(3).toString(), ingestion.get("lastRunAt"));
        assertEquals(3000L, ingestion.get("lastDurationMillis"));
        assertEquals(false, ingestion.get("lastSuccess"));

        Map<?, ?> lahore = (Map<?, ?>) tracker.citiesSnapshot().get("Lahore");
        assertEquals(T.plusSeconds(2).toString(), lahore.get("lastIngestedAt"));
        assertEquals(49, lahore.get("lastReadingsAdded"));
        assertEquals(T.plusSeconds(5).toString(), lahore.get("lastTrainedAt"));
        assertNull(lahore.get("lastTrainingError"));

        Map<?, ?> peshawar = (Map<?, ?>) tracker.citiesSnapshot().get("Peshawar");
        assertEquals("schema_mismatch: missing results", peshawar.get("lastIngestionError"));
        assertNull(peshawar.get("lastIngestedAt"));
    }

    @Test
    void successfulIngestionClearsThePreviousError() {
        EventBus bus = new EventBus();
        PipelineStatusTracker tracker = new PipelineStatusTracker(bus);

        bus.publish(new CityIngestionFailed(T, "Karachi", "ingestion_failed", "timeout"));
        bus.publish(new CityIngested(T.plusSeconds(60), "Karachi", 10, 8, 2, 0));

        Map<?, ?> karachi = (Map<?, ?>) tracker.citiesSnapshot().get("Karachi");
        assertNull(karachi.get("lastIngestionError"));
        assertEquals(8, karachi.get("lastReadingsAdded"));
    }
}
