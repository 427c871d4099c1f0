package com.agentcrew.gateway.http;

import com.agentcrew.context.ExecutionContextCache;
import com.agentcrew.orchestrator.TaskRunner;
import com.agentcrew.persistence.TaskNotFoundException;
import com.agentcrew.persistence.TaskStore;
import com.agentcrew.persistence.TelemetryStore;
import com.agentcrew.telemetry.TelemetryAggregator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class TaskController {

    private final TaskStore tasks;
    private final TelemetryStore telemetry;
    private final TaskRunner runner;
    private final ExecutionContextCache contexts;

    public TaskController(TaskStore tasks, TelemetryStore telemetry, TaskRunner runner, ExecutionContextCache contexts) {
        this.tasks = tasks;
        this.telemetry = telemetry;
        this.runner = runner;
        this.contexts = contexts;
    }

    @PostMapping("/v1/tasks")
    public ResponseEntity<Object> create(@RequestBody CreateTaskRequest body) {
        if (body == null || body.title() == null || body.crewId() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "title and crewId are required"));
        }
        var task = tasks.create(body.title(), body.description(), body.crewId(), body.mode());
        runner.submit(task.id());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(task);
    }

    @GetMapping("/v1/tasks/{id}")
    public Map<String, Object> get(@PathVariable String id) {
        var task = tasks.find(id).orElseThrow(() -> new TaskNotFoundException(id));
        return Map.of("task", task, "messages", tasks.messages(id));
    }

    @PostMapping("/v1/tasks/{id}/cancel")
    public Map<String, Object> cancel(@PathVariable String id) {
        tasks.find(id).orElseThrow(() -> new TaskNotFoundException(id));
        return Map.of("cancelled", runner.cancel(id));
    }

    @GetMapping("/v1/tasks/{id}/telemetry")
    public Map<String, Object> telemetry(@PathVariable String id) {
        tasks.find(id).orElseThrow(() -> new TaskNotFoundException(id));
        var events = telemetry.findByTask(id);
        return Map.of("events", events, "summary", TelemetryAggregator.aggregate(events));
    }

    @GetMapping("/v1/crews/{id}/capabilities")
    public Map<String, Object> capabilities(@PathVariable String id) {
        var context = contexts.get(id);
        return Map.of(
                "crewId", context.crewId(),
                "membershipVersion", context.membershipVersion(),
                "capabilities", contexts.describe(id));
    }

    @GetMapping("/v1/contexts")
    public Map<String, Object> contexts() {
        return Map.of("crews", contexts.cachedCrewIds());
    }
}
