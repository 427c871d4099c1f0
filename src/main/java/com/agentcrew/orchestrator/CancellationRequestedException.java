package com.agentcrew.orchestrator;

import com.agentcrew.shared.error.CrewException;
import com.agentcrew.shared.error.FailureCause;

public class CancellationRequestedException extends CrewException {

    public CancellationRequestedException() {
        super(FailureCause.CANCELLED, "Task run was cancelled");
    }
}
