package com.agentcrew.orchestrator;

import com.agentcrew.context.ExecutionContext;
import com.agentcrew.shared.model.Task;

public interface Orchestrator {

    /**
     * Runs a pending task to a terminal state. Failures end up in the returned result;
     * only caller misuse is thrown.
     *
     * @throws TaskAlreadyTerminalException when the task is already completed or failed
     * @throws IllegalStateException        when the task is already in progress
     */
    TaskRunResult run(ExecutionContext context, Task task, CancellationToken cancellation);
}
