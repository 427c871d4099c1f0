package com.agentcrew.persistence;

import com.agentcrew.shared.model.Agent;
import com.agentcrew.shared.model.Crew;
import com.agentcrew.shared.model.CrewMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Agents and crews held in memory. Every membership mutation, and every update of an agent
 * that belongs to a crew, bumps that crew's membership version and notifies listeners.
 */
public class InMemoryCrewRepository implements CrewRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCrewRepository.class);

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Map<String, Crew> crews = new ConcurrentHashMap<>();
    private final List<MembershipListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(MembershipListener listener) {
        listeners.add(listener);
    }

    @Override
    public Optional<Crew> findCrew(String crewId) {
        return Optional.ofNullable(crews.get(crewId));
    }

    public Optional<Agent> findAgent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public void registerAgent(Agent agent) {
        if (agents.putIfAbsent(agent.id(), agent) != null) {
            throw new IllegalArgumentException("Duplicate agent: " + agent.id());
        }
    }

    /** Replaces an agent. Crews containing it get a new membership version. */
    public void updateAgent(Agent agent) {
        if (agents.replace(agent.id(), agent) == null) {
            throw new IllegalArgumentException("Unknown agent: " + agent.id());
        }
        for (var crewId : List.copyOf(crews.keySet())) {
            var crew = crews.get(crewId);
            if (crew != null && crew.hasMember(agent.id())) {
                mutate(crewId, members -> {
                    var next = new ArrayList<CrewMember>();
                    for (var m : members) {
                        next.add(m.agentId().equals(agent.id()) ? new CrewMember(agent, m.role(), m.position()) : m);
                    }
                    return next;
                });
            }
        }
    }

    public Crew createCrew(String id, String name, String description) {
        var crew = new Crew(id, name, description, List.of(), 0);
        if (crews.putIfAbsent(id, crew) != null) {
            throw new IllegalArgumentException("Duplicate crew: " + id);
        }
        return crew;
    }

    public Crew addMember(String crewId, String agentId, String role) {
        return mutate(crewId, members -> {
            int next = members.stream().mapToInt(CrewMember::position).max().orElse(-1) + 1;
            return append(crewId, members, agentId, role, next);
        });
    }

    public Crew addMember(String crewId, String agentId, String role, int position) {
        return mutate(crewId, members -> append(crewId, members, agentId, role, position));
    }

    public Crew removeMember(String crewId, String agentId) {
        return mutate(crewId, members -> {
            var next = new ArrayList<>(members);
            if (!next.removeIf(m -> m.agentId().equals(agentId))) {
                throw new IllegalArgumentException("Agent " + agentId + " is not a member of crew " + crewId);
            }
            return next;
        });
    }

    public Crew updateMember(String crewId, String agentId, String role, int position) {
        return mutate(crewId, members -> {
            var next = new ArrayList<CrewMember>();
            boolean found = false;
            for (var m : members) {
                if (m.agentId().equals(agentId)) {
                    next.add(new CrewMember(m.agent(), role, position));
                    found = true;
                } else {
                    next.add(m);
                }
            }
            if (!found) throw new IllegalArgumentException("Agent " + agentId + " is not a member of crew " + crewId);
            return next;
        });
    }

    private List<CrewMember> append(String crewId, List<CrewMember> members, String agentId, String role, int position) {
        var agent = agents.get(agentId);
        if (agent == null) throw new IllegalArgumentException("Unknown agent: " + agentId);
        if (members.stream().anyMatch(m -> m.agentId().equals(agentId))) {
            throw new IllegalArgumentException("Agent " + agentId + " is already a member of crew " + crewId);
        }
        var next = new ArrayList<>(members);
        next.add(new CrewMember(agent, role, position));
        return next;
    }

    private Crew mutate(String crewId, UnaryOperator<List<CrewMember>> change) {
        var updated = crews.compute(crewId, (id, crew) -> {
            if (crew == null) throw new CrewNotFoundException(crewId);
            return new Crew(crew.id(), crew.name(), crew.description(),
                    change.apply(crew.members()), crew.membershipVersion() + 1);
        });
        log.debug("Crew {} membership now at version {}", crewId, updated.membershipVersion());
        listeners.forEach(l -> l.membershipChanged(crewId, updated.membershipVersion()));
        return updated;
    }
}
