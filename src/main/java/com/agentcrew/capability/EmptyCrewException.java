package com.agentcrew.capability;

import com.agentcrew.shared.error.CrewException;
import com.agentcrew.shared.error.FailureCause;

public class EmptyCrewException extends CrewException {

    public EmptyCrewException(String crewId) {
        super(FailureCause.EMPTY_CREW, "Crew " + crewId + " has no active agents");
    }
}
