package com.agentcrew.telemetry;

/**
 * Oracle token and cost totals over some set of events.
 */
public record UsageSummary(
    long oracleCalls,
    long promptTokens,
    long completionTokens,
    double costUsd
) {
    static final UsageSummary EMPTY = new UsageSummary(0, 0, 0, 0.0);

    UsageSummary plus(TelemetryEvent e) {
        return new UsageSummary(oracleCalls + 1,
                promptTokens + e.promptTokens(),
                completionTokens + e.completionTokens(),
                costUsd + e.costUsd());
    }

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
