package com.agentcrew.shared.model;

import java.util.Comparator;
import java.util.List;

/**
 * Immutable snapshot of a crew. {@code membershipVersion} grows by one on every
 * membership change, including updates of a member agent.
 */
public record Crew(
    String id,
    String name,
    String description,
    List<CrewMember> members,
    long membershipVersion
) {
    public Crew {
        members = members == null ? List.of()
                : members.stream().sorted(Comparator.comparingInt(CrewMember::position)).toList();
    }

    public boolean hasMember(String agentId) {
        return members.stream().anyMatch(m -> m.agentId().equals(agentId));
    }
}
