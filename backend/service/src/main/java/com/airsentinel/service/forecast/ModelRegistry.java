package com.airsentinel.service.forecast;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * The current model per city. Readers see either the previous or the new artifact, never a mix.
 * With a repository attached, an artifact is written to disk before it becomes visible, and a
 * failed write leaves the previous artifact in place.
 */
public class ModelRegistry {
    private static final Logger LOGGER = Logger.getLogger(ModelRegistry.class.getName());

    private final ModelArtifactRepository repository;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    public ModelRegistry() {
        this(null);
    }

    public ModelRegistry(ModelArtifactRepository repository) {
        this.repository = repository;
        if (repository != null) {
            for (ModelArtifact artifact : repository.loadAll()) {
                slotFor(artifact.city()).current = artifact;
                LOGGER.info(() -> "Loaded model for " + artifact.city() + " trained at " + artifact.trainedAt());
            }
        }
    }

    public Optional<ModelArtifact> current(String city) {
        Slot slot = slots.get(city);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.current);
    }

    public void publish(ModelArtifact artifact) {
        Objects.requireNonNull(artifact, "artifact is required");
        Slot slot = slotFor(artifact.city());
        slot.lock.lock();
        try {
            store(slot, artifact);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Publishes {@code next} only if the city's current artifact is still {@code expected}
     * ({@code null} meaning none).
     */
    public boolean compareAndPublish(ModelArtifact expected, ModelArtifact next) {
        Objects.requireNonNull(next, "next is required");
        Slot slot = slotFor(next.city());
        slot.lock.lock();
        try {
            if (slot.current != expected) {
                return false;
            }
            store(slot, next);
            return true;
        } finally {
            slot.lock.unlock();
        }
    }

    public Set<String> cities() {
        Set<String> cities = new TreeSet<>();
        slots.forEach((city, slot) -> {
            if (slot.current != null) {
                cities.add(city);
            }
        });
        return cities;
    }

    private void store(Slot slot, ModelArtifact artifact) {
        if (repository != null) {
            repository.save(artifact);
        }
        slot.current = artifact;
    }

    private Slot slotFor(String city) {
        return slots.computeIfAbsent(city, ignored -> new Slot());
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile ModelArtifact current;
    }
}
