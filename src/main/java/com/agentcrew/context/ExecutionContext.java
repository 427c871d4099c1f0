package com.agentcrew.context;

import com.agentcrew.capability.CapabilitySet;

import java.time.Instant;

/**
 * Capabilities bound for one membership version of a crew. The template is never invoked
 * directly; each task run works on its own fork.
 */
public record ExecutionContext(
    String crewId,
    String crewName,
    long membershipVersion,
    CapabilitySet template,
    Instant builtAt
) {
    public CapabilitySet forRun() {
        return template.fork();
    }
}
