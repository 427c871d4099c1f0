package com.agentcrew.orchestrator;

import com.agentcrew.capability.CapabilitySet;
import com.agentcrew.context.ExecutionContext;
import com.agentcrew.oracle.CapabilityDescriptor;
import com.agentcrew.oracle.PlanningRequest;
import com.agentcrew.persistence.TaskStore;
import com.agentcrew.shared.model.MessageAuthor;
import com.agentcrew.shared.model.Task;
import com.agentcrew.telemetry.TelemetryRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Mutable state of one task run. Confined to the thread executing the run.
 */
public final class TaskRun {

    private static final Logger log = LoggerFactory.getLogger(TaskRun.class);

    private final Task task;
    private final ExecutionContext context;
    private final CapabilitySet capabilities;
    private final List<CapabilityDescriptor> descriptors;
    private final TelemetryRecorder recorder;
    private final CancellationToken cancellation;
    private final TaskStore tasks;
    private RunState state = RunState.IDLE;
    private int iterations;

    TaskRun(Task task, ExecutionContext context, TelemetryRecorder recorder,
            CancellationToken cancellation, TaskStore tasks) {
        this.task = task;
        this.context = context;
        this.capabilities = context.forRun();
        this.descriptors = CapabilityDescriptor.of(capabilities);
        this.recorder = recorder;
        this.cancellation = cancellation;
        this.tasks = tasks;
    }

    public Task task() { return task; }
    public ExecutionContext context() { return context; }
    public CapabilitySet capabilities() { return capabilities; }
    public TelemetryRecorder recorder() { return recorder; }
    public RunState state() { return state; }
    public int iterations() { return iterations; }

    void transition(RunState next) {
        log.debug("Task {}: {} -> {}", task.id(), state, next);
        state = next;
    }

    void countIteration() {
        iterations++;
    }

    void checkCancelled() {
        cancellation.throwIfCancelled();
    }

    /** Request built from the transcript as persisted right now. */
    PlanningRequest planningRequest() {
        return new PlanningRequest(task.title(), task.description(), context.crewName(),
                tasks.messages(task.id()), descriptors);
    }

    void appendSystem(String content) {
        tasks.appendMessage(task.id(), MessageAuthor.SYSTEM, null, content);
    }

    void appendAgent(String functionName, String content) {
        tasks.appendMessage(task.id(), MessageAuthor.AGENT, functionName, content);
    }
}
