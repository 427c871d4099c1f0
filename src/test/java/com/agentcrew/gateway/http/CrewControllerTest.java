package com.agentcrew.gateway.http;

import com.agentcrew.capability.CapabilityBinder;
import com.agentcrew.context.ExecutionContextCache;
import com.agentcrew.orchestrator.TaskRunner;
import com.agentcrew.persistence.CrewNotFoundException;
import com.agentcrew.persistence.InMemoryCrewRepository;
import com.agentcrew.persistence.InMemoryTaskStore;
import com.agentcrew.persistence.InMemoryTelemetryStore;
import com.agentcrew.shared.model.Agent;
import com.agentcrew.shared.model.AgentConnection;
import com.agentcrew.shared.retry.RetryPolicy;
import com.agentcrew.transport.FakeAgentTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CrewControllerTest {

    private final InMemoryCrewRepository crews = new InMemoryCrewRepository();
    private CrewController controller;
    private TaskController tasks;

    private static Agent agent(String id, String name) {
        return new Agent(id, name, name + " agent", Map.of(), new AgentConnection(null, id, "s3cret"), true);
    }

    @BeforeEach
    void setUp() {
        crews.registerAgent(agent("writer", "Writer"));
        crews.registerAgent(agent("researcher", "Researcher"));
        crews.createCrew("c1", "Crew", null);
        crews.addMember("c1", "writer", "writes");
        var contexts = new ExecutionContextCache(crews, new CapabilityBinder(new FakeAgentTransport(), RetryPolicy.none()));
        crews.addListener(contexts);
        controller = new CrewController(crews);
        tasks = new TaskController(new InMemoryTaskStore(), new InMemoryTelemetryStore(), mock(TaskRunner.class), contexts);
    }

    private Set<?> capabilityNames() {
        return ((Map<?, ?>) tasks.capabilities("c1").get("capabilities")).keySet();
    }

    @Test
    void addedMemberShowsUpInNextCapabilities() {
        assertEquals(Set.of("ask_writer"), capabilityNames());

        var resp = controller.addMember("c1", new MemberRequest("researcher", "finds facts", null));

        assertEquals(HttpStatus.CREATED, resp.getStatusCode());
        var crew = (Map<?, ?>) resp.getBody();
        assertEquals(2L, crew.get("membershipVersion"));
        assertEquals(Set.of("ask_writer", "ask_researcher"), capabilityNames());
        assertEquals(2L, tasks.capabilities("c1").get("membershipVersion"));
    }

    @Test
    void removedMemberDisappears() {
        controller.addMember("c1", new MemberRequest("researcher", null, null));
        capabilityNames();

        var crew = controller.removeMember("c1", "writer");

        assertEquals(1, ((List<?>) crew.get("members")).size());
        assertEquals(Set.of("ask_researcher"), capabilityNames());
    }

    @Test
    void deactivatingAgentRebuildsCrew() {
        controller.addMember("c1", new MemberRequest("researcher", null, null));
        assertEquals(2, capabilityNames().size());

        var resp = controller.updateAgent("researcher", new AgentUpdateRequest(null, null, null, false));

        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertEquals(false, ((Map<?, ?>) resp.getBody()).get("active"));
        assertEquals(Set.of("ask_writer"), capabilityNames());
        assertEquals("Researcher", crews.findAgent("researcher").orElseThrow().name());
    }

    @Test
    void renamingAgentRenamesCapability() {
        controller.updateAgent("writer", new AgentUpdateRequest("Editor", null, null, null));

        assertEquals(Set.of("ask_editor"), capabilityNames());
    }

    @Test
    void updateMemberKeepsUnsetFields() {
        var crew = controller.updateMember("c1", "writer", new MemberRequest(null, null, 3));

        var member = (Map<?, ?>) ((List<?>) crew.get("members")).get(0);
        assertEquals("writes", member.get("role"));
        assertEquals(3, member.get("position"));
    }

    @Test
    void viewsHideAgentSecrets() {
        var body = (Map<?, ?>) controller.agent("writer").getBody();

        assertEquals("writer", body.get("botId"));
        assertFalse(body.toString().contains("s3cret"));
    }

    @Test
    void errorsMapToStatuses() {
        assertEquals(HttpStatus.NOT_FOUND, controller.agent("ghost").getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND,
                controller.updateAgent("ghost", new AgentUpdateRequest("x", null, null, null)).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
                controller.addMember("c1", new MemberRequest(null, null, null)).getStatusCode());
        assertThrows(CrewNotFoundException.class, () -> controller.crew("gone"));
        assertThrows(IllegalArgumentException.class,
                () -> controller.addMember("c1", new MemberRequest("writer", null, null)));
        assertThrows(IllegalArgumentException.class, () -> controller.removeMember("c1", "researcher"));
    }
}
