package com.agentcrew.shared.config;

import com.agentcrew.orchestrator.FailurePolicy;
import com.agentcrew.orchestrator.OrchestratorSettings;

public record OrchestratorConfig(
    int maxIterations,
    FailurePolicy failurePolicy,
    boolean recordReasoning,
    int workerThreads
) {
    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig(10, FailurePolicy.REPLAN, false, 8);
    }

    public OrchestratorSettings toSettings() {
        return new OrchestratorSettings(maxIterations, failurePolicy, recordReasoning);
    }
}
