package com.agentcrew.oracle;

public interface PlanningOracle {

    /**
     * Chooses the next action. Throws {@link OracleFailureException} when no decision can
     * be obtained.
     */
    OracleDecision plan(PlanningRequest request);
}
