package com.agentcrew.shared.config;

import com.agentcrew.orchestrator.FailurePolicy;
import com.agentcrew.shared.retry.RetryPolicy;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".agentcrew", "config.yaml"
    );

    public static AgentCrewConfig load() {
        return load(DEFAULT_PATH);
    }

    public static AgentCrewConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static AgentCrewConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = section(raw, "server");
        var db = section(raw, "database");
        var keys = section(raw, "api-keys");
        var pricing = section(raw, "pricing");

        var apiKeys = new HashMap<String, String>();
        keys.forEach((k, v) -> apiKeys.put(k, String.valueOf(v)));
        var openAiKey = env.apply("AGENTCREW_OPENAI_KEY");
        if (openAiKey != null) apiKeys.put("openai", openAiKey);

        var agents = parseAgents(section(raw, "agents"), env);
        return new AgentCrewConfig(
            Integer.parseInt(envOr(env, "AGENTCREW_PORT", String.valueOf(server.getOrDefault("port", 8080)))),
            Map.of(
                "url", envOr(env, "AGENTCREW_DB_URL",
                    (String) db.getOrDefault("url", "jdbc:postgresql://localhost:5432/agentcrew")),
                "username", envOr(env, "AGENTCREW_DB_USER", (String) db.getOrDefault("username", "agentcrew")),
                "password", envOr(env, "AGENTCREW_DB_PASS", (String) db.getOrDefault("password", "agentcrew"))
            ),
            Map.copyOf(apiKeys),
            parseOracle(section(raw, "oracle")),
            parseOrchestrator(section(raw, "orchestrator")),
            agents,
            parsePricing(pricing),
            String.valueOf(raw.getOrDefault("persistence", "memory")).toLowerCase(Locale.ROOT),
            parseAgentDefinitions((List<Map<String, Object>>) raw.getOrDefault("agent-definitions", List.of())),
            parseCrews((List<Map<String, Object>>) raw.getOrDefault("crews", List.of()))
        );
    }

    @SuppressWarnings("unchecked")
    private static OracleConfig parseOracle(Map<String, Object> oracle) {
        var d = OracleConfig.defaults();
        var fallbacks = (List<Object>) oracle.getOrDefault("fallback-models", List.of());
        return new OracleConfig(
            String.valueOf(oracle.getOrDefault("provider", d.provider())),
            String.valueOf(oracle.getOrDefault("model", d.model())),
            (String) oracle.getOrDefault("base-url", d.baseUrl()),
            fallbacks.stream().map(String::valueOf).toList(),
            Integer.parseInt(String.valueOf(oracle.getOrDefault("max-retries", d.maxRetries()))),
            Long.parseLong(String.valueOf(oracle.getOrDefault("retry-delay-ms", d.retryDelayMs()))),
            Double.parseDouble(String.valueOf(oracle.getOrDefault("temperature", d.temperature())))
        );
    }

    private static OrchestratorConfig parseOrchestrator(Map<String, Object> orch) {
        var d = OrchestratorConfig.defaults();
        var policy = String.valueOf(orch.getOrDefault("failure-policy", d.failurePolicy().name()))
                .toUpperCase(Locale.ROOT).replace('-', '_');
        return new OrchestratorConfig(
            Integer.parseInt(String.valueOf(orch.getOrDefault("max-iterations", d.maxIterations()))),
            FailurePolicy.valueOf(policy),
            Boolean.TRUE.equals(orch.getOrDefault("record-reasoning", d.recordReasoning())),
            Integer.parseInt(String.valueOf(orch.getOrDefault("worker-threads", d.workerThreads())))
        );
    }

    private static AgentsConfig parseAgents(Map<String, Object> agents, Function<String, String> env) {
        var d = AgentsConfig.defaults();
        var retry = section(agents, "retry");
        var directLine = section(agents, "direct-line");
        var rd = d.retry();
        return new AgentsConfig(
            new RetryPolicy(
                Integer.parseInt(String.valueOf(retry.getOrDefault("max-attempts", rd.maxAttempts()))),
                Long.parseLong(String.valueOf(retry.getOrDefault("initial-backoff-ms", rd.initialBackoffMs()))),
                Long.parseLong(String.valueOf(retry.getOrDefault("max-backoff-ms", rd.maxBackoffMs())))
            ),
            String.valueOf(directLine.getOrDefault("base-url", d.directLineBaseUrl())),
            envOr(env, "AGENTCREW_DIRECT_LINE_SECRET", String.valueOf(directLine.getOrDefault("secret", d.defaultSecret()))),
            Integer.parseInt(String.valueOf(directLine.getOrDefault("poll-attempts", d.pollAttempts()))),
            Long.parseLong(String.valueOf(directLine.getOrDefault("poll-interval-ms", d.pollIntervalMs())))
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, double[]> parsePricing(Map<String, Object> pricing) {
        var out = new LinkedHashMap<String, double[]>();
        pricing.forEach((model, value) -> {
            var prices = (Map<String, Object>) value;
            out.put(model, new double[]{
                Double.parseDouble(String.valueOf(prices.getOrDefault("prompt", 0))),
                Double.parseDouble(String.valueOf(prices.getOrDefault("completion", 0)))
            });
        });
        return out;
    }

    @SuppressWarnings("unchecked")
    private static List<AgentDefinition> parseAgentDefinitions(List<Map<String, Object>> defs) {
        var out = new ArrayList<AgentDefinition>();
        for (var def : defs) {
            out.add(new AgentDefinition(
                required(def, "id", "agent-definitions"),
                required(def, "name", "agent-definitions"),
                (String) def.get("description"),
                (Map<String, Object>) def.getOrDefault("capabilities", Map.of()),
                (String) def.get("endpoint"),
                (String) def.get("bot-id"),
                (String) def.get("secret"),
                !Boolean.FALSE.equals(def.getOrDefault("active", true))
            ));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static List<CrewDefinition> parseCrews(List<Map<String, Object>> crews) {
        var out = new ArrayList<CrewDefinition>();
        for (var crew : crews) {
            var members = new ArrayList<CrewDefinition.Member>();
            for (var m : (List<Map<String, Object>>) crew.getOrDefault("members", List.of())) {
                var position = m.get("position");
                members.add(new CrewDefinition.Member(
                    required(m, "agent", "crews.members"),
                    (String) m.get("role"),
                    position == null ? null : Integer.parseInt(String.valueOf(position))
                ));
            }
            out.add(new CrewDefinition(
                required(crew, "id", "crews"),
                String.valueOf(crew.getOrDefault("name", crew.get("id"))),
                (String) crew.get("description"),
                members
            ));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String key) {
        var value = raw.get(key);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    private static String required(Map<String, Object> map, String key, String where) {
        var value = map.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            throw new IllegalArgumentException("Missing '" + key + "' in " + where);
        }
        return String.valueOf(value);
    }

    private static String envOr(Function<String, String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
