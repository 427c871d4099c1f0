package com.agentcrew.orchestrator;

public record OrchestratorSettings(
    int maxIterations,
    FailurePolicy failurePolicy,
    boolean recordReasoning
) {
    public OrchestratorSettings {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        if (failurePolicy == null) failurePolicy = FailurePolicy.REPLAN;
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(10, FailurePolicy.REPLAN, false);
    }
}
