package com.agentcrew.oracle;

/** Plans a whole task up front and merges the agents' answers afterwards. */
public interface PlanDrafter {

    PlanDraft draft(PlanningRequest request);

    /** Returns a decision whose action is {@link Action.Conclude}. */
    OracleDecision aggregate(PlanningRequest request);
}
