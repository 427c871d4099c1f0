package com.agentcrew.orchestrator;

import com.agentcrew.shared.error.FailureCause;
import com.agentcrew.shared.model.TaskStatus;
import com.agentcrew.telemetry.TelemetryEvent;

import java.util.List;

/**
 * Outcome of one run. {@code result} is set when completed, {@code cause} and
 * {@code causeMessage} when failed. {@code iterations} counts oracle calls.
 */
public record TaskRunResult(
    String taskId,
    TaskStatus status,
    String result,
    FailureCause cause,
    String causeMessage,
    List<TelemetryEvent> events,
    int iterations
) {
    public TaskRunResult {
        events = List.copyOf(events);
    }

    public static TaskRunResult completed(String taskId, String result, List<TelemetryEvent> events, int iterations) {
        return new TaskRunResult(taskId, TaskStatus.COMPLETED, result, null, null, events, iterations);
    }

    public static TaskRunResult failed(String taskId, FailureCause cause, String message,
                                       List<TelemetryEvent> events, int iterations) {
        return new TaskRunResult(taskId, TaskStatus.FAILED, null, cause, message, events, iterations);
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }
}
