package com.agentcrew.orchestrator;

public enum RunState {
    IDLE,
    PLANNING,
    INVOKING,
    CONCLUDING,
    DONE,
    FAILED
}
