package com.agentcrew.shared.config;

import java.util.List;
import java.util.Map;

public record AgentCrewConfig(
    int serverPort,
    Map<String, String> database,
    Map<String, String> apiKeys,
    OracleConfig oracle,
    OrchestratorConfig orchestrator,
    AgentsConfig agents,
    Map<String, double[]> pricing,
    String persistence,
    List<AgentDefinition> agentDefinitions,
    List<CrewDefinition> crews
) {
    public boolean jdbcPersistence() {
        return "jdbc".equalsIgnoreCase(persistence);
    }
}
