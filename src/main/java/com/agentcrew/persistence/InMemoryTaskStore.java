package com.agentcrew.persistence;

import com.agentcrew.shared.model.ExecutionMode;
import com.agentcrew.shared.model.MessageAuthor;
import com.agentcrew.shared.model.Task;
import com.agentcrew.shared.model.TaskMessage;
import com.agentcrew.shared.model.TaskStatus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTaskStore implements TaskStore {

    private final Clock clock;
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, List<TaskMessage>> transcripts = new ConcurrentHashMap<>();

    public InMemoryTaskStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTaskStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Task create(String title, String description, String crewId, ExecutionMode mode) {
        var task = Task.pending(UUID.randomUUID().toString(), title, description, crewId, mode, clock.instant());
        tasks.put(task.id(), task);
        transcripts.put(task.id(), new ArrayList<>());
        return task;
    }

    @Override
    public Optional<Task> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public boolean markInProgress(String taskId) {
        var started = new boolean[1];
        tasks.computeIfPresent(taskId, (id, t) -> {
            if (t.status() != TaskStatus.PENDING) return t;
            started[0] = true;
            return t.started(clock.instant());
        });
        return started[0];
    }

    @Override
    public void markCompleted(String taskId, String result) {
        finish(taskId, t -> t.completed(result, clock.instant()));
    }

    @Override
    public void markFailed(String taskId, String error) {
        finish(taskId, t -> t.failed(error, clock.instant()));
    }

    @Override
    public TaskMessage appendMessage(String taskId, MessageAuthor author, String authorName, String content) {
        var transcript = transcripts.get(taskId);
        if (transcript == null) throw new TaskNotFoundException(taskId);
        synchronized (transcript) {
            var msg = new TaskMessage(taskId, transcript.size() + 1L, author, authorName, content, clock.instant());
            transcript.add(msg);
            return msg;
        }
    }

    @Override
    public List<TaskMessage> messages(String taskId) {
        var transcript = transcripts.get(taskId);
        if (transcript == null) return List.of();
        synchronized (transcript) {
            return List.copyOf(transcript);
        }
    }

    private void finish(String taskId, java.util.function.UnaryOperator<Task> change) {
        var updated = tasks.computeIfPresent(taskId, (id, t) -> {
            if (t.status() != TaskStatus.IN_PROGRESS) {
                throw new IllegalStateException("Task " + taskId + " is " + t.status() + ", not IN_PROGRESS");
            }
            return change.apply(t);
        });
        if (updated == null) throw new TaskNotFoundException(taskId);
    }
}
