package com.agentcrew.persistence;

import com.agentcrew.shared.model.Crew;

import java.util.Optional;

public interface CrewRepository {
    Optional<Crew> findCrew(String crewId);
}
