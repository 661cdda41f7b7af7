package com.airsentinel.service.store;

import com.airsentinel.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EventStore {
    void append(Event event);

    /**
     * The newest {@code limit} events at or after {@code since}, oldest first.
     */
    List<Event> query(Instant since, Optional<String> type, int limit);
}
