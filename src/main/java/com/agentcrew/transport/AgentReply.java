package com.agentcrew.transport;

public record AgentReply(
    String reply,
    String sessionToken
) {}
