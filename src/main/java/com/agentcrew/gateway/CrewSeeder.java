package com.agentcrew.gateway;

import com.agentcrew.persistence.InMemoryCrewRepository;
import com.agentcrew.shared.config.AgentCrewConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Registers the agents and crews declared in the config file. */
public final class CrewSeeder {

    private static final Logger log = LoggerFactory.getLogger(CrewSeeder.class);

    private CrewSeeder() {}

    public static void seed(InMemoryCrewRepository repository, AgentCrewConfig config) {
        var secret = config.agents().defaultSecret();
        for (var def : config.agentDefinitions()) {
            repository.registerAgent(def.toAgent(secret));
        }
        for (var crew : config.crews()) {
            repository.createCrew(crew.id(), crew.name(), crew.description());
            for (var m : crew.members()) {
                if (m.position() != null) {
                    repository.addMember(crew.id(), m.agentId(), m.role(), m.position());
                } else {
                    repository.addMember(crew.id(), m.agentId(), m.role());
                }
            }
        }
        log.info("Seeded {} agents and {} crews from config",
                config.agentDefinitions().size(), config.crews().size());
    }
}
