package com.agentcrew.providers;

import java.util.List;
import java.util.Map;

/**
 * OpenAI-shaped chat request. {@code model} may be null, in which case the provider's
 * default model is used.
 */
public record ChatRequest(
    String model,
    List<Map<String, Object>> messages,
    double temperature,
    List<Map<String, Object>> tools
) {
    public ChatRequest(String model, List<Map<String, Object>> messages, double temperature) {
        this(model, messages, temperature, null);
    }

    public ChatRequest withModel(String other) {
        return new ChatRequest(other, messages, temperature, tools);
    }
}
