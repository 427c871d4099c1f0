package com.agentcrew.capability;

import com.agentcrew.shared.error.CrewException;
import com.agentcrew.shared.model.AgentConnection;
import com.agentcrew.shared.retry.ResilientCall;
import com.agentcrew.shared.retry.RetriesExhaustedException;
import com.agentcrew.shared.retry.RetryPolicy;
import com.agentcrew.transport.AgentErrorException;
import com.agentcrew.transport.AgentReply;
import com.agentcrew.transport.AgentTransport;
import com.agentcrew.transport.AgentUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * One remote agent exposed to the planner as a named function. The first successful
 * call captures the agent's session token; later calls send it back so the agent sees
 * one continuous conversation. Instances are confined to a single task run.
 */
public class AgentCapability {

    private static final Logger log = LoggerFactory.getLogger(AgentCapability.class);

    private final String agentId;
    private final String agentName;
    private final String functionName;
    private final String description;
    private final AgentConnection connection;
    private final AgentTransport transport;
    private final RetryPolicy retryPolicy;
    private final SessionHolder session;

    public AgentCapability(String agentId, String agentName, String functionName, String description,
                           AgentConnection connection, AgentTransport transport, RetryPolicy retryPolicy) {
        this(agentId, agentName, functionName, description, connection, transport, retryPolicy, new SessionHolder());
    }

    private AgentCapability(String agentId, String agentName, String functionName, String description,
                            AgentConnection connection, AgentTransport transport, RetryPolicy retryPolicy,
                            SessionHolder session) {
        this.agentId = agentId;
        this.agentName = agentName;
        this.functionName = functionName;
        this.description = description;
        this.connection = connection;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.session = session;
    }

    public String agentId() { return agentId; }
    public String agentName() { return agentName; }
    public String functionName() { return functionName; }
    public String description() { return description; }

    /** Current session token, or null before the first successful call. */
    public String sessionToken() {
        return session.get();
    }

    /**
     * Sends {@code message} under the retry policy. A retry after a partial failure reuses
     * the conversation the failed attempt opened and, when the message was already
     * delivered, only waits for the reply.
     *
     * @throws AgentUnavailableException when every attempt allowed by the retry policy failed
     * @throws AgentErrorException       when the agent reported an error
     */
    public String invoke(String message) {
        var progress = new AtomicReference<AgentUnavailableException>();
        try {
            var reply = ResilientCall.execute(
                    () -> attempt(message, progress),
                    retryPolicy,
                    e -> e instanceof AgentUnavailableException);
            session.set(reply.sessionToken());
            return reply.reply() != null ? reply.reply() : "";
        } catch (RetriesExhaustedException e) {
            var cause = e.getCause();
            if (cause instanceof AgentUnavailableException) {
                log.warn("Agent {} unavailable after {} attempts", functionName, e.attempts());
            }
            // keep a conversation that was opened so the next call continues it
            var last = progress.get();
            if (last != null) session.set(last.resumeToken());
            if (cause instanceof CrewException ce) throw ce;
            if (cause instanceof RuntimeException re) throw re;
            throw new AgentErrorException("Agent " + functionName + " failed: " + cause, cause);
        }
    }

    private AgentReply attempt(String message, AtomicReference<AgentUnavailableException> progress) {
        var last = progress.get();
        try {
            if (last == null) return transport.send(connection, message, session.get());
            if (last.delivered()) return transport.awaitReply(connection, last.resumeToken());
            return transport.send(connection, message, last.resumeToken());
        } catch (AgentUnavailableException e) {
            if (e.hasProgress()) progress.set(e);
            throw e;
        }
    }

    /** Same agent and description, fresh session. */
    public AgentCapability fork() {
        return new AgentCapability(agentId, agentName, functionName, description,
                connection, transport, retryPolicy, new SessionHolder());
    }
}
