package com.agentcrew.transport;

import com.agentcrew.shared.model.AgentConnection;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Scriptable transport keyed by bot id. Hands out a new session token per conversation
 * and records every call.
 */
public class FakeAgentTransport implements AgentTransport {

    public record Call(String botId, String message, String sessionTokenSent) {}

    private final Map<String, UnaryOperator<String>> replies = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final AtomicInteger sessions = new AtomicInteger();
    private final List<Call> calls = new ArrayList<>();

    public FakeAgentTransport reply(String botId, UnaryOperator<String> reply) {
        replies.put(botId, reply);
        return this;
    }

    public FakeAgentTransport fail(String botId, RuntimeException error) {
        failures.put(botId, error);
        return this;
    }

    @Override
    public AgentReply send(AgentConnection connection, String message, String sessionToken) {
        synchronized (calls) {
            calls.add(new Call(connection.botId(), message, sessionToken));
        }
        var failure = failures.get(connection.botId());
        if (failure != null) throw failure;
        var token = sessionToken != null ? sessionToken : "session-" + sessions.incrementAndGet();
        var reply = replies.getOrDefault(connection.botId(), m -> connection.botId() + " says: " + m);
        return new AgentReply(reply.apply(message), token);
    }

    public List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long callsTo(String botId) {
        return calls().stream().filter(c -> c.botId().equals(botId)).count();
    }
}
