package com.agentcrew.shared.config;

import com.agentcrew.shared.model.Agent;
import com.agentcrew.shared.model.AgentConnection;

import java.util.Map;

/** An agent declared in the config file, registered at startup. */
public record AgentDefinition(
    String id,
    String name,
    String description,
    Map<String, Object> capabilities,
    String endpoint,
    String botId,
    String secret,
    boolean active
) {
    public Agent toAgent(String fallbackSecret) {
        var key = secret == null || secret.isBlank() ? fallbackSecret : secret;
        return new Agent(id, name, description, capabilities,
                new AgentConnection(endpoint, botId != null ? botId : id, key), active);
    }
}
