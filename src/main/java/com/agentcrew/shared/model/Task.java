package com.agentcrew.shared.model;

import java.time.Instant;

public record Task(
    String id,
    String title,
    String description,
    String crewId,
    ExecutionMode mode,
    TaskStatus status,
    String result,
    String error,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {
    public Task {
        if (mode == null) mode = ExecutionMode.DYNAMIC;
        if (status == null) status = TaskStatus.PENDING;
    }

    public static Task pending(String id, String title, String description, String crewId,
                               ExecutionMode mode, Instant createdAt) {
        return new Task(id, title, description, crewId, mode, TaskStatus.PENDING,
                null, null, createdAt, null, null);
    }

    public Task started(Instant at) {
        return new Task(id, title, description, crewId, mode, TaskStatus.IN_PROGRESS,
                null, null, createdAt, at, null);
    }

    public Task completed(String result, Instant at) {
        return new Task(id, title, description, crewId, mode, TaskStatus.COMPLETED,
                result, null, createdAt, startedAt, at);
    }

    public Task failed(String error, Instant at) {
        return new Task(id, title, description, crewId, mode, TaskStatus.FAILED,
                null, error, createdAt, startedAt, at);
    }
}
