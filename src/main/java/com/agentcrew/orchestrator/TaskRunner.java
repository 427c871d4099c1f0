package com.agentcrew.orchestrator;

import com.agentcrew.capability.EmptyCrewException;
import com.agentcrew.context.ExecutionContext;
import com.agentcrew.context.ExecutionContextCache;
import com.agentcrew.logging.MdcContext;
import com.agentcrew.persistence.CrewNotFoundException;
import com.agentcrew.persistence.TaskNotFoundException;
import com.agentcrew.persistence.TaskStore;
import com.agentcrew.shared.error.FailureCause;
import com.agentcrew.shared.model.ExecutionMode;
import com.agentcrew.shared.model.MessageAuthor;
import com.agentcrew.shared.model.Task;
import com.agentcrew.shared.model.TaskStatus;
import com.agentcrew.telemetry.CrewMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks on a bounded worker pool, one job per task, picking the orchestrator by the
 * task's execution mode.
 */
public class TaskRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final TaskStore tasks;
    private final ExecutionContextCache contexts;
    private final Map<ExecutionMode, Orchestrator> strategies;
    private final CrewMetrics metrics;
    private final ExecutorService executor;
    private final Map<String, CancellationToken> active = new ConcurrentHashMap<>();

    public TaskRunner(TaskStore tasks, ExecutionContextCache contexts, Map<ExecutionMode, Orchestrator> strategies,
                      CrewMetrics metrics, int workerThreads) {
        if (!strategies.containsKey(ExecutionMode.DYNAMIC)) {
            throw new IllegalArgumentException("A DYNAMIC orchestrator is required");
        }
        this.tasks = tasks;
        this.contexts = contexts;
        this.strategies = new EnumMap<>(strategies);
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, workerThreads), r -> {
            var t = new Thread(r, "task-runner-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @throws TaskNotFoundException        when the task does not exist
     * @throws TaskAlreadyTerminalException when the task already finished
     * @throws IllegalStateException        when the task is already running
     */
    public CompletableFuture<TaskRunResult> submit(String taskId) {
        var task = tasks.find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (task.status().isTerminal()) throw new TaskAlreadyTerminalException(taskId, task.status());
        var token = new CancellationToken();
        if (active.putIfAbsent(taskId, token) != null) {
            throw new IllegalStateException("Task " + taskId + " is already submitted");
        }
        try {
            return CompletableFuture.supplyAsync(() -> runJob(task, token), executor)
                    .whenComplete((result, error) -> active.remove(taskId, token));
        } catch (RuntimeException e) {
            active.remove(taskId, token);
            throw e;
        }
    }

    /** Requests cancellation; true when the task had an active run. */
    public boolean cancel(String taskId) {
        var token = active.get(taskId);
        if (token == null) return false;
        token.cancel();
        log.info("Cancellation requested for task {}", taskId);
        return true;
    }

    public boolean isActive(String taskId) {
        return active.containsKey(taskId);
    }

    private TaskRunResult runJob(Task task, CancellationToken token) {
        ExecutionContext context;
        try {
            context = contexts.get(task.crewId());
        } catch (EmptyCrewException | CrewNotFoundException e) {
            return failBeforeRun(task, e.failureCause(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not build execution context for task {}", task.id(), e);
            return failBeforeRun(task, FailureCause.INTERNAL, e.toString());
        }
        var orchestrator = strategies.getOrDefault(task.mode(), strategies.get(ExecutionMode.DYNAMIC));
        return orchestrator.run(context, task, token);
    }

    private TaskRunResult failBeforeRun(Task task, FailureCause cause, String message) {
        MdcContext.setRun(task.id(), task.crewId());
        try {
            log.warn("Task {} cannot run: {}", task.id(), message);
            if (!tasks.markInProgress(task.id())) {
                var current = tasks.find(task.id()).orElseThrow(() -> new TaskNotFoundException(task.id()));
                throw new TaskAlreadyTerminalException(task.id(), current.status());
            }
            var error = cause + ": " + message;
            tasks.appendMessage(task.id(), MessageAuthor.SYSTEM, null, "Task failed: " + error);
            tasks.markFailed(task.id(), error);
            metrics.tasks(TaskStatus.FAILED).increment();
            return TaskRunResult.failed(task.id(), cause, message, List.of(), 0);
        } finally {
            MdcContext.clear();
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Task runner did not stop in time, interrupting workers");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
