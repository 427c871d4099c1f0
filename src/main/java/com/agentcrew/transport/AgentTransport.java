package com.agentcrew.transport;

import com.agentcrew.shared.model.AgentConnection;

/**
 * Single-call access to a remote conversational agent.
 */
public interface AgentTransport {

    /**
     * Sends one message and waits for the agent's reply.
     *
     * @param sessionToken token returned by an earlier call to continue that conversation,
     *                     or {@code null} to start a new one
     * @throws AgentUnavailableException when the endpoint cannot be reached
     * @throws AgentErrorException       when the agent reports an application-level failure
     */
    AgentReply send(AgentConnection connection, String message, String sessionToken);

    /**
     * Waits for the reply to a message an interrupted {@link #send} already delivered, as
     * reported by {@link AgentUnavailableException#delivered()}.
     */
    default AgentReply awaitReply(AgentConnection connection, String sessionToken) {
        throw new AgentErrorException("Transport cannot resume a delivered message");
    }
}
