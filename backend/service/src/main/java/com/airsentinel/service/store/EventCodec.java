package com.airsentinel.service.store;

import com.airsentinel.core.events.CityIngested;
import com.airsentinel.core.events.CityIngestionFailed;
import com.airsentinel.core.events.Event;
import com.airsentinel.core.events.JobCompleted;
import com.airsentinel.core.events.JobStarted;
import com.airsentinel.core.events.ModelPublished;
import com.airsentinel.core.events.TrainingFailed;
import com.airsentinel.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * JSONL envelope for pipeline events: {@code {"type":..., "timestamp":..., "event":{...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "JobStarted", JobStarted.class,
            "JobCompleted", JobCompleted.class,
            "CityIngested", CityIngested.class,
            "CityIngestionFailed", CityIngestionFailed.class,
            "ModelPublished", ModelPublished.class,
            "TrainingFailed", TrainingFailed.class
    );

    private EventCodec() {
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
