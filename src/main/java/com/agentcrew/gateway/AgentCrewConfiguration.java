package com.agentcrew.gateway;

import com.agentcrew.capability.CapabilityBinder;
import com.agentcrew.context.ExecutionContextCache;
import com.agentcrew.oracle.ChatCompletionOracle;
import com.agentcrew.orchestrator.FixedPlanOrchestrator;
import com.agentcrew.orchestrator.Orchestrator;
import com.agentcrew.orchestrator.PlanAndCallOrchestrator;
import com.agentcrew.orchestrator.TaskRunner;
import com.agentcrew.persistence.InMemoryCrewRepository;
import com.agentcrew.persistence.InMemoryTaskStore;
import com.agentcrew.persistence.InMemoryTelemetryStore;
import com.agentcrew.persistence.JdbcTaskStore;
import com.agentcrew.persistence.JdbcTelemetryStore;
import com.agentcrew.persistence.TaskStore;
import com.agentcrew.persistence.TelemetryStore;
import com.agentcrew.providers.DeepSeekProvider;
import com.agentcrew.providers.ModelProvider;
import com.agentcrew.providers.OllamaProvider;
import com.agentcrew.providers.OpenAiProvider;
import com.agentcrew.providers.ReliableProvider;
import com.agentcrew.shared.config.AgentCrewConfig;
import com.agentcrew.shared.config.ConfigLoader;
import com.agentcrew.shared.config.OracleConfig;
import com.agentcrew.shared.model.ExecutionMode;
import com.agentcrew.telemetry.CostEstimator;
import com.agentcrew.telemetry.CrewMetrics;
import com.agentcrew.transport.DirectLineTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@Configuration
public class AgentCrewConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentCrewConfiguration.class);

    @Bean
    public AgentCrewConfig agentCrewConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public CrewMetrics crewMetrics() {
        return new CrewMetrics();
    }

    @Bean
    public CostEstimator costEstimator(AgentCrewConfig config) {
        return new CostEstimator(config.pricing());
    }

    @Bean
    public TaskStore taskStore(AgentCrewConfig config, ObjectProvider<DataSource> dataSource) {
        if (config.jdbcPersistence()) {
            log.info("Tasks are stored in PostgreSQL");
            return new JdbcTaskStore(dataSource.getObject());
        }
        return new InMemoryTaskStore();
    }

    @Bean
    public TelemetryStore telemetryStore(AgentCrewConfig config, ObjectProvider<DataSource> dataSource) {
        return config.jdbcPersistence() ? new JdbcTelemetryStore(dataSource.getObject()) : new InMemoryTelemetryStore();
    }

    @Bean
    public InMemoryCrewRepository crewRepository(AgentCrewConfig config) {
        var repository = new InMemoryCrewRepository();
        CrewSeeder.seed(repository, config);
        return repository;
    }

    @Bean
    public DirectLineTransport directLineTransport(AgentCrewConfig config) {
        var agents = config.agents();
        return new DirectLineTransport(agents.directLineBaseUrl(), agents.pollAttempts(),
                Duration.ofMillis(agents.pollIntervalMs()));
    }

    @Bean
    public ExecutionContextCache executionContextCache(InMemoryCrewRepository repository,
                                                       DirectLineTransport transport, AgentCrewConfig config) {
        var cache = new ExecutionContextCache(repository, new CapabilityBinder(transport, config.agents().retry()));
        repository.addListener(cache);
        return cache;
    }

    @Bean
    public ChatCompletionOracle chatCompletionOracle(AgentCrewConfig config) {
        var oracle = config.oracle();
        var provider = new ReliableProvider(List.of(modelProvider(oracle, config.apiKeys())),
                oracle.maxRetries(), oracle.retryDelayMs(),
                oracle.fallbackModels().isEmpty() ? Map.of() : Map.of(oracle.model(), oracle.fallbackModels()));
        return new ChatCompletionOracle(provider, oracle.model(), oracle.temperature());
    }

    @Bean(destroyMethod = "close")
    public TaskRunner taskRunner(AgentCrewConfig config, TaskStore taskStore, TelemetryStore telemetryStore,
                                 ExecutionContextCache cache, ChatCompletionOracle oracle,
                                 CrewMetrics metrics, CostEstimator costEstimator) {
        var settings = config.orchestrator().toSettings();
        var strategies = Map.<ExecutionMode, Orchestrator>of(
                ExecutionMode.DYNAMIC,
                new PlanAndCallOrchestrator(oracle, taskStore, telemetryStore, metrics, costEstimator, settings),
                ExecutionMode.FIXED_PLAN,
                new FixedPlanOrchestrator(oracle, taskStore, telemetryStore, metrics, costEstimator, settings));
        return new TaskRunner(taskStore, cache, strategies, metrics, config.orchestrator().workerThreads());
    }

    static ModelProvider modelProvider(OracleConfig oracle, Map<String, String> apiKeys) {
        return switch (oracle.provider()) {
            case "deepseek" -> new DeepSeekProvider(apiKey(apiKeys, "deepseek"));
            case "ollama" -> new OllamaProvider(oracle.baseUrl(), oracle.model());
            case "openai" -> new OpenAiProvider(apiKey(apiKeys, "openai"), oracle.baseUrl(), oracle.model());
            default -> throw new IllegalArgumentException("Unknown oracle provider: " + oracle.provider());
        };
    }

    private static String apiKey(Map<String, String> apiKeys, String provider) {
        var key = apiKeys.getOrDefault(provider, "");
        if (key.isBlank()) {
            log.warn("{} API key not configured. Set api-keys.{} in ~/.agentcrew/config.yaml", provider, provider);
        }
        return key;
    }
}
