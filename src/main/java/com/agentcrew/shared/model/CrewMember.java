package com.agentcrew.shared.model;

public record CrewMember(
    Agent agent,
    String role,
    int position
) {
    public String agentId() {
        return agent.id();
    }
}
