package com.agentcrew.persistence;

import com.agentcrew.telemetry.TelemetryEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface TelemetryStore {

    void saveAll(Collection<TelemetryEvent> events);

    List<TelemetryEvent> findByTask(String taskId);

    /** Events that started in {@code [from, to)}, across all tasks. */
    List<TelemetryEvent> findBetween(Instant from, Instant to);
}
