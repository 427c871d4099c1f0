package com.agentcrew.providers;

import java.util.List;

public record ChatResponse(
    String model,
    String content,
    TokenUsage usage,
    List<ToolCallInfo> toolCalls
) {
    public ChatResponse {
        if (usage == null) usage = TokenUsage.NONE;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public ChatResponse(String model, String content, TokenUsage usage) {
        this(model, content, usage, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
