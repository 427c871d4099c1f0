package com.agentcrew.orchestrator;

import com.agentcrew.context.ExecutionContext;
import com.agentcrew.logging.MdcContext;
import com.agentcrew.oracle.Action;
import com.agentcrew.oracle.ModelUsage;
import com.agentcrew.oracle.OracleFailureException;
import com.agentcrew.persistence.TaskNotFoundException;
import com.agentcrew.persistence.TaskStore;
import com.agentcrew.persistence.TelemetryStore;
import com.agentcrew.shared.error.CrewException;
import com.agentcrew.shared.error.FailureCause;
import com.agentcrew.shared.model.Task;
import com.agentcrew.shared.model.TaskStatus;
import com.agentcrew.telemetry.CostEstimator;
import com.agentcrew.telemetry.CrewMetrics;
import com.agentcrew.telemetry.TelemetryKind;
import com.agentcrew.telemetry.TelemetryRecorder;
import com.agentcrew.transport.AgentErrorException;
import com.agentcrew.transport.AgentUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Task lifecycle shared by all strategies: claims the task, runs {@link #execute}, writes
 * the terminal message and status, then hands the run's telemetry to the store and to
 * the metrics registry.
 */
public abstract class AbstractTaskOrchestrator implements Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(AbstractTaskOrchestrator.class);

    static final String ORACLE_TARGET = "oracle";

    protected final TaskStore tasks;
    protected final OrchestratorSettings settings;
    private final TelemetryStore telemetryStore;
    private final CrewMetrics metrics;
    private final CostEstimator costEstimator;
    private final Clock clock;

    protected AbstractTaskOrchestrator(TaskStore tasks, TelemetryStore telemetryStore, CrewMetrics metrics,
                                       CostEstimator costEstimator, OrchestratorSettings settings, Clock clock) {
        this.tasks = tasks;
        this.telemetryStore = telemetryStore;
        this.metrics = metrics;
        this.costEstimator = costEstimator;
        this.settings = settings;
        this.clock = clock;
    }

    /** Drives the run and returns the final answer; any thrown exception fails the task. */
    protected abstract String execute(TaskRun run);

    @Override
    public final TaskRunResult run(ExecutionContext context, Task task, CancellationToken cancellation) {
        claim(task.id());
        MdcContext.setRun(task.id(), task.crewId());
        metrics.taskStarted();
        var run = new TaskRun(task, context, new TelemetryRecorder(task.id(), clock, costEstimator),
                cancellation, tasks);
        log.info("Task {} started on crew {} (context version {})", task.id(), context.crewId(),
                context.membershipVersion());
        TaskRunResult result;
        try {
            result = complete(run, execute(run));
        } catch (CrewException e) {
            result = fail(run, e.failureCause(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Task {} failed unexpectedly", task.id(), e);
            result = fail(run, FailureCause.INTERNAL, e.toString());
        } finally {
            MdcContext.clear();
        }
        publish(run, result.status());
        return result;
    }

    private void claim(String taskId) {
        if (tasks.markInProgress(taskId)) return;
        var current = tasks.find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (current.status().isTerminal()) {
            throw new TaskAlreadyTerminalException(taskId, current.status());
        }
        throw new IllegalStateException("Task " + taskId + " is already " + current.status());
    }

    private TaskRunResult complete(TaskRun run, String answer) {
        run.transition(RunState.DONE);
        var id = run.task().id();
        try {
            run.appendSystem(answer);
            tasks.markCompleted(id, answer);
        } catch (RuntimeException e) {
            log.error("Could not record completion of task {}", id, e);
            run.transition(RunState.FAILED);
            try {
                tasks.markFailed(id, FailureCause.INTERNAL + ": " + e);
            } catch (RuntimeException again) {
                log.error("Could not mark task {} failed either", id, again);
            }
            return TaskRunResult.failed(id, FailureCause.INTERNAL, e.toString(), run.recorder().events(), run.iterations());
        }
        log.info("Task {} completed after {} planning steps", id, run.iterations());
        return TaskRunResult.completed(id, answer, run.recorder().events(), run.iterations());
    }

    private TaskRunResult fail(TaskRun run, FailureCause cause, String message) {
        run.transition(RunState.FAILED);
        var id = run.task().id();
        var error = cause + ": " + message;
        try {
            run.appendSystem("Task failed: " + error);
            tasks.markFailed(id, error);
        } catch (RuntimeException e) {
            log.error("Could not record failure of task {}", id, e);
        }
        log.info("Task {} failed: {}", id, error);
        return TaskRunResult.failed(id, cause, message, run.recorder().events(), run.iterations());
    }

    private void publish(TaskRun run, TaskStatus status) {
        var events = run.recorder().events();
        try {
            telemetryStore.saveAll(events);
        } catch (RuntimeException e) {
            log.error("Could not persist {} telemetry events for task {}", events.size(), run.task().id(), e);
        }
        metrics.recordAll(events);
        metrics.taskFinished(status);
    }

    /** One oracle call, bracketed by an ORACLE_CALL event. */
    protected <T extends ModelUsage> T consult(TaskRun run, Supplier<T> call) {
        run.checkCancelled();
        run.transition(RunState.PLANNING);
        run.countIteration();
        var span = run.recorder().begin(TelemetryKind.ORACLE_CALL, ORACLE_TARGET);
        T answer;
        try {
            answer = call.get();
        } catch (RuntimeException e) {
            span.fail(e);
            if (e instanceof CrewException) throw e;
            throw new OracleFailureException("Oracle call failed: " + e.getMessage(), e);
        }
        span.succeed(answer.model(), answer.promptTokens(), answer.completionTokens());
        return answer;
    }

    /**
     * Calls one capability, bracketed by an AGENT_CALL event. The reply is appended as an
     * agent message. Unknown capabilities and, under {@link FailurePolicy#REPLAN}, agent
     * failures are appended as system observations instead.
     */
    protected void invoke(TaskRun run, Action.Invoke action) {
        run.checkCancelled();
        run.transition(RunState.INVOKING);
        var capability = run.capabilities().get(action.capability());
        if (capability == null) {
            log.warn("Oracle asked for unknown capability {}", action.capability());
            run.appendSystem("Unknown capability '" + action.capability() + "'. Available: "
                    + String.join(", ", run.capabilities().names()));
            return;
        }
        if (settings.recordReasoning() && action.reasoning() != null && !action.reasoning().isBlank()) {
            run.appendSystem("Reasoning: " + action.reasoning());
        }

        var span = run.recorder().begin(TelemetryKind.AGENT_CALL, capability.functionName());
        String reply;
        try {
            reply = capability.invoke(action.message());
        } catch (AgentUnavailableException | AgentErrorException e) {
            span.fail(e);
            if (settings.failurePolicy() == FailurePolicy.FAIL_FAST) throw e;
            log.warn("Agent {} failed ({}), replanning: {}", capability.functionName(),
                    e.failureCause(), e.getMessage());
            run.appendSystem("Agent " + capability.functionName() + " failed (" + e.failureCause() + "): "
                    + e.getMessage());
            return;
        } catch (RuntimeException e) {
            span.fail(e);
            throw e;
        }
        span.succeed();
        run.appendAgent(capability.functionName(), reply);
    }
}
