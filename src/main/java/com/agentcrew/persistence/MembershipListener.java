package com.agentcrew.persistence;

@FunctionalInterface
public interface MembershipListener {
    void membershipChanged(String crewId, long newVersion);
}
