package com.agentcrew.shared.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Agent(
    String id,
    String name,
    String description,
    Map<String, Object> capabilities,
    AgentConnection connection,
    boolean active
) {
    public Agent {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("agent id must not be empty");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("agent name must not be empty");
        capabilities = capabilities != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(capabilities)) : Map.of();
    }

    public Agent withActive(boolean active) {
        return new Agent(id, name, description, capabilities, connection, active);
    }
}
