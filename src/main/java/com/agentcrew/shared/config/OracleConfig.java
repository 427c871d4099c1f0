package com.agentcrew.shared.config;

import java.util.List;

public record OracleConfig(
    String provider,
    String model,
    String baseUrl,
    List<String> fallbackModels,
    int maxRetries,
    long retryDelayMs,
    double temperature
) {
    public static OracleConfig defaults() {
        return new OracleConfig("openai", "gpt-4o-mini", null, List.of(), 2, 500, 0.7);
    }
}
