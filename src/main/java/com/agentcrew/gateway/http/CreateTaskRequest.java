package com.agentcrew.gateway.http;

import com.agentcrew.shared.model.ExecutionMode;

public record CreateTaskRequest(
    String title,
    String description,
    String crewId,
    ExecutionMode mode
) {}
