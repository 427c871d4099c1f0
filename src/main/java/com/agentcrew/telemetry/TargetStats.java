package com.agentcrew.telemetry;

import java.time.Duration;

public record TargetStats(
    TelemetryKind kind,
    String target,
    long calls,
    long successes,
    Duration totalLatency,
    long promptTokens,
    long completionTokens,
    double costUsd
) {
    static TargetStats empty(TelemetryKind kind, String target) {
        return new TargetStats(kind, target, 0, 0, Duration.ZERO, 0, 0, 0.0);
    }

    TargetStats plus(TelemetryEvent e) {
        return new TargetStats(kind, target,
                calls + 1,
                successes + (e.success() ? 1 : 0),
                totalLatency.plus(e.latency()),
                promptTokens + e.promptTokens(),
                completionTokens + e.completionTokens(),
                costUsd + e.costUsd());
    }

    public long failures() {
        return calls - successes;
    }

    public double successRate() {
        return calls == 0 ? 0.0 : (double) successes / calls;
    }

    public Duration averageLatency() {
        return calls == 0 ? Duration.ZERO : totalLatency.dividedBy(calls);
    }
}
