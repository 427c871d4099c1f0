package com.agentcrew.providers;

public class OpenAiProvider extends OpenAiCompatibleProvider {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    public OpenAiProvider(String apiKey, String baseUrl, String model) {
        super(apiKey, baseUrl != null ? baseUrl : DEFAULT_BASE_URL, model);
    }

    @Override
    public String id() {
        return "openai";
    }
}
