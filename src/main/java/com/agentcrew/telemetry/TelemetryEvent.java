package com.agentcrew.telemetry;

import java.time.Duration;
import java.time.Instant;

/**
 * One bracketed call to the oracle or to an agent. Token and cost fields are zero for
 * agent calls.
 */
public record TelemetryEvent(
    String taskId,
    TelemetryKind kind,
    String target,
    Instant startedAt,
    Instant endedAt,
    boolean success,
    String error,
    String model,
    int promptTokens,
    int completionTokens,
    double costUsd
) {
    public Duration latency() {
        return Duration.between(startedAt, endedAt);
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
