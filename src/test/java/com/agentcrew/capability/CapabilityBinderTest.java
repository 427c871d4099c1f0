package com.agentcrew.capability;

import com.agentcrew.shared.model.Agent;
import com.agentcrew.shared.model.AgentConnection;
import com.agentcrew.shared.model.CrewMember;
import com.agentcrew.shared.retry.RetryPolicy;
import com.agentcrew.transport.FakeAgentTransport;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CapabilityBinderTest {

    private final CapabilityBinder binder = new CapabilityBinder(new FakeAgentTransport(), RetryPolicy.none());

    private static CrewMember member(String id, String name, int position, boolean active) {
        var agent = new Agent(id, name, name + " agent", Map.of("skill", "search"),
                new AgentConnection(null, id, "secret"), active);
        return new CrewMember(agent, "analyst", position);
    }

    @Test
    void namesCapabilitiesAfterAgents() {
        var set = binder.bind("c1", List.of(member("a1", "Market Researcher", 0, true),
                member("a2", "Writer", 1, true)));

        assertEquals(List.of("ask_market_researcher", "ask_writer"), set.names());
        assertEquals("a1", set.get("ask_market_researcher").agentId());
    }

    @Test
    void skipsInactiveAgents() {
        var set = binder.bind("c1", List.of(member("a1", "Researcher", 0, false),
                member("a2", "Writer", 1, true)));

        assertEquals(List.of("ask_writer"), set.names());
    }

    @Test
    void failsWhenNoAgentIsActive() {
        var ex = assertThrows(EmptyCrewException.class,
                () -> binder.bind("c1", List.of(member("a1", "Researcher", 0, false))));
        assertTrue(ex.getMessage().contains("c1"));
        assertThrows(EmptyCrewException.class, () -> binder.bind("c2", List.of()));
    }

    @Test
    void disambiguatesCollidingNamesWithAgentId() {
        var set = binder.bind("c1", List.of(member("r-1", "Researcher", 0, true),
                member("r-2", "researcher!", 1, true),
                member("w", "Writer", 2, true)));

        assertEquals(List.of("ask_researcher_r_1", "ask_researcher_r_2", "ask_writer"), set.names());
    }

    @Test
    void fallsBackToPositionWhenIdsCollideToo() {
        var set = binder.bind("c1", List.of(member("r.1", "Researcher", 0, true),
                member("r-1", "Researcher", 4, true)));

        assertEquals(List.of("ask_researcher_r_1", "ask_researcher_r_1_4"), set.names());
    }

    @Test
    void countsUpWhenPositionSuffixIsTakenToo() {
        var members = List.of(member("1", "bot", 0, true),
                member("z", "bot", 1, true),
                member("x", "bot 1 5", 2, true),
                member("y", "bot 1", 5, true));

        var set = binder.bind("c1", members);

        assertEquals(List.of("ask_bot_1", "ask_bot_z", "ask_bot_1_5", "ask_bot_1_5_2"), set.names());
        assertEquals("y", set.get("ask_bot_1_5_2").agentId());
        assertEquals(set.names(), binder.bind("c1", members).names());
    }

    @Test
    void namingIsStableAcrossRebuilds() {
        var members = List.of(member("r-1", "Researcher", 0, true), member("r-2", "Researcher", 1, true));
        assertEquals(binder.bind("c1", members).names(), binder.bind("c1", members).names());
    }

    @Test
    void describesAgentRoleAndCapabilities() {
        var set = binder.bind("c1", List.of(member("a1", "Researcher", 0, true)));

        assertThat(set.get("ask_researcher").description())
                .contains("Researcher agent")
                .contains("Role in this crew: analyst")
                .contains("{\"skill\":\"search\"}");
    }

    @Test
    void sanitizesNames() {
        assertEquals("ask_data_science_bot", CapabilityBinder.baseName("  Data-Science  Bot!! "));
        assertEquals("ask_agent", CapabilityBinder.baseName("***"));
    }
}
