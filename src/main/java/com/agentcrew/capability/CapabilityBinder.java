package com.agentcrew.capability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.agentcrew.shared.model.CrewMember;
import com.agentcrew.shared.retry.RetryPolicy;
import com.agentcrew.transport.AgentTransport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a crew's active members into a {@link CapabilitySet}.
 *
 * <p>Function names are {@code ask_<agent name>}. When several active members map to the
 * same name, each of them gets its agent id appended; if that still collides the member's
 * position is appended too, followed by {@code _2}, {@code _3} and so on until the name is
 * free. The result depends only on the membership, so rebuilding from
 * the same membership yields the same names.
 */
public class CapabilityBinder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AgentTransport transport;
    private final RetryPolicy retryPolicy;

    public CapabilityBinder(AgentTransport transport, RetryPolicy retryPolicy) {
        this.transport = transport;
        this.retryPolicy = retryPolicy;
    }

    public CapabilitySet bind(String crewId, List<CrewMember> members) {
        var active = members.stream()
                .filter(m -> m.agent() != null && m.agent().active())
                .toList();
        if (active.isEmpty()) throw new EmptyCrewException(crewId);

        var baseCounts = new HashMap<String, Integer>();
        for (var m : active) baseCounts.merge(baseName(m.agent().name()), 1, Integer::sum);

        var used = new HashSet<String>();
        var capabilities = new ArrayList<AgentCapability>();
        for (var m : active) {
            var agent = m.agent();
            var name = baseName(agent.name());
            if (baseCounts.get(name) > 1) name = name + "_" + sanitize(agent.id());
            if (!used.add(name)) {
                var candidate = name + "_" + m.position();
                for (int n = 2; !used.add(candidate); n++) {
                    candidate = name + "_" + m.position() + "_" + n;
                }
                name = candidate;
            }
            capabilities.add(new AgentCapability(agent.id(), agent.name(), name, describe(m),
                    agent.connection(), transport, retryPolicy));
        }
        return new CapabilitySet(capabilities);
    }

    static String baseName(String agentName) {
        var slug = sanitize(agentName);
        return "ask_" + (slug.isEmpty() ? "agent" : slug);
    }

    static String sanitize(String raw) {
        return raw.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_")
                .replaceAll("^_+|_+$", "");
    }

    private static String describe(CrewMember member) {
        var agent = member.agent();
        var sb = new StringBuilder("Ask the ").append(agent.name())
                .append(" agent a question or give it a task.");
        if (agent.description() != null && !agent.description().isBlank()) {
            sb.append(' ').append(agent.description().trim());
        }
        if (member.role() != null && !member.role().isBlank()) {
            sb.append(" Role in this crew: ").append(member.role()).append('.');
        }
        if (!agent.capabilities().isEmpty()) {
            sb.append(" Capabilities: ").append(toJson(agent.capabilities()));
        }
        return sb.toString();
    }

    private static String toJson(Map<String, Object> capabilities) {
        try {
            return MAPPER.writeValueAsString(capabilities);
        } catch (JsonProcessingException e) {
            return capabilities.toString();
        }
    }
}
