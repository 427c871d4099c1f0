package com.agentcrew.providers;

public interface ModelProvider {
    String id();
    ChatResponse chat(ChatRequest request);
}
