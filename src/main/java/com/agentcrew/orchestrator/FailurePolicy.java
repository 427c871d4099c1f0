package com.agentcrew.orchestrator;

/** What an agent failure does to the run. */
public enum FailurePolicy {
    /** Report the failure to the oracle and keep planning. */
    REPLAN,
    /** End the run as failed. */
    FAIL_FAST
}
