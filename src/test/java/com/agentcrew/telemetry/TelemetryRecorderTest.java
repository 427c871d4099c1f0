package com.agentcrew.telemetry;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryRecorderTest {

    static class StepClock extends Clock {
        private Instant now = Instant.parse("2026-03-01T10:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    private final StepClock clock = new StepClock();
    private final TelemetryRecorder recorder = new TelemetryRecorder("t1", clock, new CostEstimator());

    @Test
    void spanMeasuresLatencyAndCost() {
        var span = recorder.begin(TelemetryKind.ORACLE_CALL, "oracle");
        clock.advance(Duration.ofMillis(250));
        var event = span.succeed("gpt-4o-mini", 1_000_000, 0);

        assertEquals(Duration.ofMillis(250), event.latency());
        assertEquals(0.15, event.costUsd(), 1e-9);
        assertTrue(event.success());
        assertEquals("t1", event.taskId());
    }

    @Test
    void failedSpanKeepsErrorAndNoTokens() {
        var span = recorder.begin(TelemetryKind.AGENT_CALL, "ask_writer");
        var event = span.fail(new IllegalStateException("HTTP 503"));

        assertFalse(event.success());
        assertEquals("HTTP 503", event.error());
        assertEquals(0, event.totalTokens());
        assertEquals(0.0, event.costUsd());
    }

    @Test
    void failureWithoutMessageUsesExceptionName() {
        var event = recorder.begin(TelemetryKind.AGENT_CALL, "ask_writer").fail(new NullPointerException());
        assertEquals("NullPointerException", event.error());
    }

    @Test
    void spanClosesOnce() {
        var span = recorder.begin(TelemetryKind.AGENT_CALL, "ask_writer");
        span.succeed();
        assertThrows(IllegalStateException.class, span::succeed);
        assertEquals(1, recorder.events().size());
    }

    @Test
    void eventsAppearInCloseOrder() {
        var outer = recorder.begin(TelemetryKind.ORACLE_CALL, "oracle");
        var inner = recorder.begin(TelemetryKind.AGENT_CALL, "ask_writer");
        inner.succeed();
        outer.succeed();

        assertEquals("ask_writer", recorder.events().get(0).target());
        assertEquals(1, recorder.count(TelemetryKind.ORACLE_CALL));
    }
}
