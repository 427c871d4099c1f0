package com.agentcrew.persistence;

import com.agentcrew.telemetry.TelemetryEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryTelemetryStore implements TelemetryStore {

    private final List<TelemetryEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void saveAll(Collection<TelemetryEvent> batch) {
        events.addAll(batch);
    }

    @Override
    public List<TelemetryEvent> findByTask(String taskId) {
        return events.stream().filter(e -> e.taskId().equals(taskId)).toList();
    }

    @Override
    public List<TelemetryEvent> findBetween(Instant from, Instant to) {
        return events.stream()
                .filter(e -> !e.startedAt().isBefore(from) && e.startedAt().isBefore(to))
                .toList();
    }

    public List<TelemetryEvent> all() {
        return List.copyOf(events);
    }
}
