package com.agentcrew.providers;

import java.time.Duration;

/** Local models are slow to answer planning prompts, hence the long timeout. */
public class OllamaProvider extends OpenAiCompatibleProvider {

    public OllamaProvider(String baseUrl, String model) {
        super(null, baseUrl != null ? baseUrl : "http://localhost:11434/v1", model, Duration.ofSeconds(120));
    }

    @Override
    public String id() {
        return "ollama";
    }
}
