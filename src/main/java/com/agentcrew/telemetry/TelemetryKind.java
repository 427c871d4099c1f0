package com.agentcrew.telemetry;

public enum TelemetryKind {
    ORACLE_CALL,
    AGENT_CALL;

    public String tag() {
        return name().toLowerCase();
    }
}
