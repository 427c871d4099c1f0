package com.agentcrew.shared.config;

import java.util.List;

public record CrewDefinition(
    String id,
    String name,
    String description,
    List<Member> members
) {
    /** {@code position} is null when the member should be appended. */
    public record Member(String agentId, String role, Integer position) {}
}
