package com.agentcrew.transport;

import com.agentcrew.shared.error.CrewException;
import com.agentcrew.shared.error.FailureCause;

/**
 * The remote agent answered, but with an error. Never retried.
 */
public class AgentErrorException extends CrewException {

    public AgentErrorException(String message) {
        super(FailureCause.AGENT_ERROR, message);
    }

    public AgentErrorException(String message, Throwable cause) {
        super(FailureCause.AGENT_ERROR, message, cause);
    }
}
