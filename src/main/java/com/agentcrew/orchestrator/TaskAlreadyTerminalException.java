package com.agentcrew.orchestrator;

import com.agentcrew.shared.model.TaskStatus;

public class TaskAlreadyTerminalException extends IllegalStateException {

    private final String taskId;
    private final TaskStatus status;

    public TaskAlreadyTerminalException(String taskId, TaskStatus status) {
        super("Task " + taskId + " is already " + status);
        this.taskId = taskId;
        this.status = status;
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus status() {
        return status;
    }
}
