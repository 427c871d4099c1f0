package com.agentcrew.shared.model;

/**
 * Where and how to reach one remote agent.
 *
 * @param endpoint base URL of the bot service
 * @param botId    id of the bot behind the endpoint, sent with every activity
 * @param secret   bearer secret for the endpoint
 */
public record AgentConnection(
    String endpoint,
    String botId,
    String secret
) {
    @Override
    public String toString() {
        return "AgentConnection[endpoint=" + endpoint + ", botId=" + botId + ", secret=***]";
    }
}
