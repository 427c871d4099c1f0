package com.agentcrew.telemetry;

import com.agentcrew.shared.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicInteger;

public class CrewMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger tasksInProgress = new AtomicInteger();

    public CrewMetrics() {
        this(new SimpleMeterRegistry());
    }

    public CrewMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("agentcrew.tasks.in_progress", tasksInProgress, AtomicInteger::get)
                .register(registry);
    }

    public MeterRegistry registry() { return registry; }

    public Counter calls(TelemetryKind kind, String target, boolean success) {
        return Counter.builder("agentcrew.calls")
                .tag("kind", kind.tag())
                .tag("target", target)
                .tag("outcome", success ? "success" : "error")
                .register(registry);
    }

    public Timer latency(TelemetryKind kind, String target) {
        return Timer.builder("agentcrew.call.latency")
                .tag("kind", kind.tag())
                .tag("target", target)
                .register(registry);
    }

    public Counter tokens(String model, String type) {
        return Counter.builder("agentcrew.tokens")
                .tag("model", model)
                .tag("type", type)
                .register(registry);
    }

    public Counter cost(String model) {
        return Counter.builder("agentcrew.cost.usd").tag("model", model).register(registry);
    }

    public Counter tasks(TaskStatus status) {
        return Counter.builder("agentcrew.tasks").tag("status", status.name().toLowerCase()).register(registry);
    }

    public int tasksInProgress() {
        return tasksInProgress.get();
    }

    public void taskStarted() {
        tasksInProgress.incrementAndGet();
    }

    public void taskFinished(TaskStatus status) {
        tasksInProgress.decrementAndGet();
        tasks(status).increment();
    }

    public void record(TelemetryEvent event) {
        calls(event.kind(), event.target(), event.success()).increment();
        latency(event.kind(), event.target()).record(event.latency());
        if (event.model() != null) {
            tokens(event.model(), "prompt").increment(event.promptTokens());
            tokens(event.model(), "completion").increment(event.completionTokens());
            if (event.costUsd() > 0) cost(event.model()).increment(event.costUsd());
        }
    }

    public void recordAll(Collection<TelemetryEvent> events) {
        events.forEach(this::record);
    }
}
