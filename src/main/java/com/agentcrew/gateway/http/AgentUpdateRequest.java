package com.agentcrew.gateway.http;

import java.util.Map;

/** Partial agent update; null fields keep their current value. */
public record AgentUpdateRequest(
    String name,
    String description,
    Map<String, Object> capabilities,
    Boolean active
) {}
