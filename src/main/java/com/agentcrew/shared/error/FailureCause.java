package com.agentcrew.shared.error;

/**
 * Terminal cause recorded on a failed task run.
 */
public enum FailureCause {
    EMPTY_CREW,
    CREW_NOT_FOUND,
    AGENT_UNAVAILABLE,
    AGENT_ERROR,
    ORACLE_FAILURE,
    ITERATION_LIMIT,
    CANCELLED,
    INTERNAL
}
