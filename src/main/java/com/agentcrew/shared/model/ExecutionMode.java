package com.agentcrew.shared.model;

/**
 * Which orchestration strategy runs a task.
 */
public enum ExecutionMode {
    /** The oracle picks one capability call at a time. */
    DYNAMIC,
    /** The oracle drafts every step up front, then aggregates the replies. */
    FIXED_PLAN
}
