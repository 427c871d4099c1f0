package com.agentcrew.orchestrator;

import com.agentcrew.shared.error.CrewException;
import com.agentcrew.shared.error.FailureCause;

public class PlanningIterationLimitExceededException extends CrewException {

    public PlanningIterationLimitExceededException(int limit) {
        super(FailureCause.ITERATION_LIMIT, "No final answer after " + limit + " planning steps");
    }
}
