package com.agentcrew.telemetry;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Collects the telemetry of one task run. Each call is bracketed by {@link #begin} before
 * it is issued and {@link Span#succeed}/{@link Span#fail} right after it returns.
 * Events are appended in close order and never change afterwards.
 */
public class TelemetryRecorder {

    private final String taskId;
    private final Clock clock;
    private final CostEstimator costEstimator;
    private final List<TelemetryEvent> events = new ArrayList<>();

    public TelemetryRecorder(String taskId, Clock clock, CostEstimator costEstimator) {
        this.taskId = taskId;
        this.clock = clock;
        this.costEstimator = costEstimator;
    }

    public Span begin(TelemetryKind kind, String target) {
        return new Span(kind, target, clock.instant());
    }

    public synchronized List<TelemetryEvent> events() {
        return List.copyOf(events);
    }

    public synchronized long count(TelemetryKind kind) {
        return events.stream().filter(e -> e.kind() == kind).count();
    }

    private synchronized TelemetryEvent append(TelemetryEvent event) {
        events.add(event);
        return event;
    }

    public final class Span {

        private final TelemetryKind kind;
        private final String target;
        private final Instant startedAt;
        private final AtomicBoolean closed = new AtomicBoolean();

        private Span(TelemetryKind kind, String target, Instant startedAt) {
            this.kind = kind;
            this.target = target;
            this.startedAt = startedAt;
        }

        public TelemetryEvent succeed() {
            return close(true, null, null, 0, 0);
        }

        public TelemetryEvent succeed(String model, int promptTokens, int completionTokens) {
            return close(true, null, model, promptTokens, completionTokens);
        }

        public TelemetryEvent fail(Throwable error) {
            var msg = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            return close(false, msg, null, 0, 0);
        }

        private TelemetryEvent close(boolean success, String error, String model,
                                     int promptTokens, int completionTokens) {
            if (!closed.compareAndSet(false, true)) {
                throw new IllegalStateException("Span already closed: " + kind + " " + target);
            }
            var cost = costEstimator.estimate(model, promptTokens, completionTokens);
            return append(new TelemetryEvent(taskId, kind, target, startedAt, clock.instant(),
                    success, error, model, promptTokens, completionTokens, cost));
        }
    }
}
