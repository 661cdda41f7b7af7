package com.airsentinel.service.support;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.Event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class EventCapture {
    private final List<Event> events = new CopyOnWriteArrayList<>();

    public EventCapture(EventBus bus) {
        bus.subscribeAll(events::add);
    }

    public <T extends Event> List<T> byType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public List<Event> all() {
        return List.copyOf(events);
    }
}
