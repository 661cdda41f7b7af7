package com.airsentinel.service.store;

import com.airsentinel.core.events.Event;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pipeline event log. Every event is appended to a JSONL file, and the newest {@code retained}
 * events stay in memory to answer queries. The file is read once, on construction; events older
 * than the retained tail remain on disk only.
 */
public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());
    static final int DEFAULT_RETAINED = 2000;

    private final Path file;
    private final int retained;
    private final Deque<Event> tail = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this(file, DEFAULT_RETAINED);
    }

    public JsonlEventStore(Path file, int retained) {
        if (retained <= 0) {
            throw new IllegalArgumentException("retained must be positive");
        }
        this.file = file;
        this.retained = retained;
        JsonlFiles.forEachLine(file, this::restore);
        if (!tail.isEmpty()) {
            LOGGER.info(() -> "Restored " + tail.size() + " recent events from " + file);
        }
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            JsonlFiles.append(file, List.of(line));
            remember(event);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        List<Event> newestFirst = new ArrayList<>();
        lock.lock();
        try {
            Iterator<Event> newer = tail.descendingIterator();
            while (newer.hasNext() && newestFirst.size() < limit) {
                Event event = newer.next();
                if (event.timestamp().isBefore(since)) {
                    continue;
                }
                if (type.isEmpty() || type.get().equals(event.type())) {
                    newestFirst.add(event);
                }
            }
        } finally {
            lock.unlock();
        }
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    private void restore(int lineNumber, String line) {
        Event event;
        try {
            event = EventCodec.fromJsonLine(line);
        } catch (RuntimeException decodeError) {
            // a crash mid-write leaves a torn last line
            LOGGER.log(Level.WARNING, "Skipping invalid event at line " + lineNumber + " of " + file, decodeError);
            return;
        }
        remember(event);
    }

    private void remember(Event event) {
        tail.addLast(event);
        if (tail.size() > retained) {
            tail.removeFirst();
        }
    }
}
