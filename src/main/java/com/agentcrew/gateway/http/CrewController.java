package com.agentcrew.gateway.http;

import com.agentcrew.persistence.CrewNotFoundException;
import com.agentcrew.persistence.InMemoryCrewRepository;
import com.agentcrew.shared.model.Agent;
import com.agentcrew.shared.model.Crew;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Crew membership and agent maintenance. Every change goes through the repository, which
 * bumps the crew's membership version, so the next task on that crew runs against a
 * rebuilt capability set.
 */
@RestController
public class CrewController {

    private static final Logger log = LoggerFactory.getLogger(CrewController.class);

    private final InMemoryCrewRepository crews;

    public CrewController(InMemoryCrewRepository crews) {
        this.crews = crews;
    }

    @GetMapping("/v1/crews/{id}")
    public Map<String, Object> crew(@PathVariable String id) {
        return view(crews.findCrew(id).orElseThrow(() -> new CrewNotFoundException(id)));
    }

    @PostMapping("/v1/crews/{id}/members")
    public ResponseEntity<Object> addMember(@PathVariable String id, @RequestBody MemberRequest body) {
        if (body == null || body.agentId() == null || body.agentId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "agentId is required"));
        }
        var crew = body.position() != null
                ? crews.addMember(id, body.agentId(), body.role(), body.position())
                : crews.addMember(id, body.agentId(), body.role());
        log.info("Agent {} joined crew {} (version {})", body.agentId(), id, crew.membershipVersion());
        return ResponseEntity.status(HttpStatus.CREATED).body(view(crew));
    }

    @PutMapping("/v1/crews/{id}/members/{agentId}")
    public Map<String, Object> updateMember(@PathVariable String id, @PathVariable String agentId,
                                            @RequestBody MemberRequest body) {
        var crew = crews.findCrew(id).orElseThrow(() -> new CrewNotFoundException(id));
        var current = crew.members().stream()
                .filter(m -> m.agentId().equals(agentId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Agent " + agentId + " is not a member of crew " + id));
        var role = body != null && body.role() != null ? body.role() : current.role();
        var position = body != null && body.position() != null ? body.position() : current.position();
        return view(crews.updateMember(id, agentId, role, position));
    }

    @DeleteMapping("/v1/crews/{id}/members/{agentId}")
    public Map<String, Object> removeMember(@PathVariable String id, @PathVariable String agentId) {
        var crew = crews.removeMember(id, agentId);
        log.info("Agent {} left crew {} (version {})", agentId, id, crew.membershipVersion());
        return view(crew);
    }

    @GetMapping("/v1/agents/{id}")
    public ResponseEntity<Object> agent(@PathVariable String id) {
        return crews.findAgent(id)
                .<ResponseEntity<Object>>map(a -> ResponseEntity.ok(view(a)))
                .orElseGet(() -> agentNotFound(id));
    }

    @PutMapping("/v1/agents/{id}")
    public ResponseEntity<Object> updateAgent(@PathVariable String id, @RequestBody AgentUpdateRequest body) {
        var current = crews.findAgent(id).orElse(null);
        if (current == null) return agentNotFound(id);
        if (body == null) return ResponseEntity.ok(view(current));
        var updated = new Agent(id,
                body.name() != null ? body.name() : current.name(),
                body.description() != null ? body.description() : current.description(),
                body.capabilities() != null ? body.capabilities() : current.capabilities(),
                current.connection(),
                body.active() != null ? body.active() : current.active());
        crews.updateAgent(updated);
        log.info("Agent {} updated (active={})", id, updated.active());
        return ResponseEntity.ok(view(updated));
    }

    private static ResponseEntity<Object> agentNotFound(String id) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Agent not found: " + id));
    }

    // secrets stay out of responses
    static Map<String, Object> view(Agent agent) {
        var out = new LinkedHashMap<String, Object>();
        out.put("id", agent.id());
        out.put("name", agent.name());
        out.put("description", agent.description());
        out.put("capabilities", agent.capabilities());
        out.put("active", agent.active());
        out.put("botId", agent.connection() != null ? agent.connection().botId() : null);
        return out;
    }

    static Map<String, Object> view(Crew crew) {
        var members = crew.members().stream().map(m -> {
            var member = new LinkedHashMap<String, Object>();
            member.put("agentId", m.agentId());
            member.put("name", m.agent().name());
            member.put("role", m.role());
            member.put("position", m.position());
            member.put("active", m.agent().active());
            return member;
        }).toList();
        var out = new LinkedHashMap<String, Object>();
        out.put("id", crew.id());
        out.put("name", crew.name());
        out.put("description", crew.description());
        out.put("membershipVersion", crew.membershipVersion());
        out.put("members", members);
        return out;
    }
}
