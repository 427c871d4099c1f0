package com.agentcrew.gateway;

import com.agentcrew.providers.DeepSeekProvider;
import com.agentcrew.providers.OllamaProvider;
import com.agentcrew.providers.OpenAiProvider;
import com.agentcrew.shared.config.OracleConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentCrewConfigurationTest {

    private static OracleConfig oracle(String provider) {
        return new OracleConfig(provider, "some-model", null, List.of(), 0, 1, 0.5);
    }

    @Test
    void selectsProviderByName() {
        var keys = Map.of("openai", "sk", "deepseek", "ds");
        assertInstanceOf(OpenAiProvider.class, AgentCrewConfiguration.modelProvider(oracle("openai"), keys));
        assertInstanceOf(DeepSeekProvider.class, AgentCrewConfiguration.modelProvider(oracle("deepseek"), keys));
        var ollama = AgentCrewConfiguration.modelProvider(oracle("ollama"), Map.of());
        assertInstanceOf(OllamaProvider.class, ollama);
        assertEquals("some-model", ((OllamaProvider) ollama).defaultModel());
    }

    @Test
    void unknownProviderIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> AgentCrewConfiguration.modelProvider(oracle("bard"), Map.of()));
    }
}
