package com.agentcrew.persistence;

import com.agentcrew.shared.error.CrewException;
import com.agentcrew.shared.error.FailureCause;

public class CrewNotFoundException extends CrewException {

    public CrewNotFoundException(String crewId) {
        super(FailureCause.CREW_NOT_FOUND, "Crew not found: " + crewId);
    }
}
