package com.agentcrew.oracle;

import com.agentcrew.shared.model.TaskMessage;

import java.util.List;

/**
 * Everything the oracle is shown for one planning step. The transcript is the task's full
 * message history so far, in sequence order.
 */
public record PlanningRequest(
    String taskTitle,
    String taskDescription,
    String crewName,
    List<TaskMessage> transcript,
    List<CapabilityDescriptor> capabilities
) {
    public PlanningRequest {
        transcript = List.copyOf(transcript);
        capabilities = List.copyOf(capabilities);
    }
}
