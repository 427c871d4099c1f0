package com.agentcrew.oracle;

/** Model usage reported alongside an oracle answer. */
public interface ModelUsage {
    String model();
    int promptTokens();
    int completionTokens();
}
