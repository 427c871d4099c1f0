package com.agentcrew.gateway;

import com.agentcrew.persistence.InMemoryCrewRepository;
import com.agentcrew.shared.config.AgentCrewConfig;
import com.agentcrew.shared.config.AgentDefinition;
import com.agentcrew.shared.config.AgentsConfig;
import com.agentcrew.shared.config.CrewDefinition;
import com.agentcrew.shared.config.OracleConfig;
import com.agentcrew.shared.config.OrchestratorConfig;
import com.agentcrew.shared.model.CrewMember;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CrewSeederTest {

    private static AgentCrewConfig config(List<AgentDefinition> agents, List<CrewDefinition> crews) {
        return new AgentCrewConfig(8080, Map.of(), Map.of(), OracleConfig.defaults(), OrchestratorConfig.defaults(),
                AgentsConfig.defaults(), Map.of(), "memory", agents, crews);
    }

    private static AgentDefinition agent(String id, String secret) {
        return new AgentDefinition(id, id.toUpperCase(), null, Map.of(), null, null, secret, true);
    }

    @Test
    void registersAgentsAndCrews() {
        var repo = new InMemoryCrewRepository();
        CrewSeeder.seed(repo, config(
                List.of(agent("a", null), agent("b", "own-secret")),
                List.of(new CrewDefinition("c1", "Crew", null, List.of(
                        new CrewDefinition.Member("a", "lead", 5),
                        new CrewDefinition.Member("b", null, null))))));

        var crew = repo.findCrew("c1").orElseThrow();
        assertEquals(List.of("a", "b"), crew.members().stream().map(CrewMember::agentId).toList());
        assertEquals(List.of(5, 6), crew.members().stream().map(CrewMember::position).toList());
        assertEquals("", repo.findAgent("a").orElseThrow().connection().secret());
        assertEquals("own-secret", repo.findAgent("b").orElseThrow().connection().secret());
    }

    @Test
    void memberMustReferenceDeclaredAgent() {
        var repo = new InMemoryCrewRepository();
        var cfg = config(List.of(), List.of(new CrewDefinition("c1", "Crew", null,
                List.of(new CrewDefinition.Member("ghost", null, null)))));

        assertThrows(IllegalArgumentException.class, () -> CrewSeeder.seed(repo, cfg));
    }
}
