package com.agentcrew.transport;

import com.agentcrew.shared.error.CrewException;
import com.agentcrew.shared.error.FailureCause;

/**
 * Transient transport failure. Retried by the capability before it surfaces.
 *
 * <p>A failure part way through a call carries how far the call got: the session token of
 * a conversation that was already opened, and whether the message was already delivered.
 * A retry resumes from there instead of opening another conversation or sending the
 * message twice.
 */
public class AgentUnavailableException extends CrewException {

    private final String resumeToken;
    private final boolean delivered;

    public AgentUnavailableException(String message) {
        this(message, null, null, false);
    }

    public AgentUnavailableException(String message, Throwable cause) {
        this(message, cause, null, false);
    }

    public AgentUnavailableException(String message, Throwable cause, String resumeToken, boolean delivered) {
        super(FailureCause.AGENT_UNAVAILABLE, message, cause);
        this.resumeToken = resumeToken;
        this.delivered = delivered;
    }

    /** Session token of the conversation the failed call opened or continued, or null. */
    public String resumeToken() {
        return resumeToken;
    }

    /** True when the message reached the agent and only its reply was lost. */
    public boolean delivered() {
        return delivered;
    }

    public boolean hasProgress() {
        return resumeToken != null;
    }
}
