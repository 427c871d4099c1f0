package com.agentcrew.telemetry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryAggregatorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static TelemetryEvent event(TelemetryKind kind, String target, long millis, boolean ok,
                                        int prompt, int completion, double cost) {
        return new TelemetryEvent("t1", kind, target, T0, T0.plusMillis(millis), ok, ok ? null : "err",
                prompt > 0 ? "gpt-4o" : null, prompt, completion, cost);
    }

    @Test
    void groupsByKindAndTarget() {
        var stats = TelemetryAggregator.aggregate(List.of(
                event(TelemetryKind.ORACLE_CALL, "oracle", 100, true, 500, 50, 0.01),
                event(TelemetryKind.AGENT_CALL, "ask_writer", 300, true, 0, 0, 0),
                event(TelemetryKind.AGENT_CALL, "ask_writer", 100, false, 0, 0, 0),
                event(TelemetryKind.ORACLE_CALL, "oracle", 300, true, 700, 150, 0.02)));

        assertEquals(2, stats.size());
        var oracle = stats.get(0);
        assertEquals(2, oracle.calls());
        assertEquals(1200, oracle.promptTokens());
        assertEquals(200, oracle.completionTokens());
        assertEquals(0.03, oracle.costUsd(), 1e-9);
        assertEquals(Duration.ofMillis(200), oracle.averageLatency());

        var writer = stats.get(1);
        assertEquals(1, writer.failures());
        assertEquals(0.5, writer.successRate());
    }

    @Test
    void byTargetFiltersKind() {
        var agents = TelemetryAggregator.byTarget(List.of(
                event(TelemetryKind.ORACLE_CALL, "oracle", 10, true, 1, 1, 0),
                event(TelemetryKind.AGENT_CALL, "ask_researcher", 10, true, 0, 0, 0)), TelemetryKind.AGENT_CALL);

        assertEquals(List.of("ask_researcher"), List.copyOf(agents.keySet()));
    }

    @Test
    void usageCountsOracleCallsOnly() {
        var events = List.of(
                event(TelemetryKind.ORACLE_CALL, "oracle", 10, true, 500, 50, 0.01),
                event(TelemetryKind.AGENT_CALL, "ask_writer", 10, true, 0, 0, 0),
                event(TelemetryKind.ORACLE_CALL, "oracle", 10, false, 0, 0, 0));

        var usage = TelemetryAggregator.usage(events);
        assertEquals(2, usage.oracleCalls());
        assertEquals(550, usage.totalTokens());
        assertEquals(0.01, usage.costUsd(), 1e-9);

        var byModel = TelemetryAggregator.usageByModel(events);
        assertEquals(List.of("gpt-4o", "unknown"), List.copyOf(byModel.keySet()));
        assertEquals(1, byModel.get("unknown").oracleCalls());
    }

    @Test
    void emptyInputGivesNoStats() {
        assertTrue(TelemetryAggregator.aggregate(List.of()).isEmpty());
        assertEquals(0, TelemetryAggregator.usage(List.of()).oracleCalls());
    }
}
