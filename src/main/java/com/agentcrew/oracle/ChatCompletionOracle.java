package com.agentcrew.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.agentcrew.providers.ChatRequest;
import com.agentcrew.providers.ChatResponse;
import com.agentcrew.providers.ModelProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Oracle backed by a chat-completions model with function calling. Each capability is
 * offered as a function taking one {@code message} string; a function call becomes
 * {@link Action.Invoke} and a plain reply becomes {@link Action.Conclude}.
 */
public class ChatCompletionOracle implements PlanningOracle, PlanDrafter {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionOracle.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String FALLBACK_REASONING = "Fallback plan due to JSON parsing error";

    private final ModelProvider provider;
    private final String model;
    private final double temperature;
    private final PromptBuilder prompts = new PromptBuilder();

    public ChatCompletionOracle(ModelProvider provider, String model, double temperature) {
        this.provider = provider;
        this.model = model;
        this.temperature = temperature;
    }

    @Override
    public OracleDecision plan(PlanningRequest request) {
        var resp = call(new ChatRequest(model, prompts.orchestrate(request), temperature,
                toolsDef(request.capabilities())));
        if (resp.hasToolCalls()) {
            if (resp.toolCalls().size() > 1) {
                log.debug("Model requested {} calls at once, taking the first", resp.toolCalls().size());
            }
            var tc = resp.toolCalls().get(0);
            var reasoning = resp.content() == null || resp.content().isBlank() ? null : resp.content().trim();
            return decision(new Action.Invoke(tc.name(), messageArgument(tc.arguments()), reasoning), resp);
        }
        if (resp.content() == null || resp.content().isBlank()) {
            throw new OracleFailureException("Model returned neither a function call nor an answer");
        }
        return decision(new Action.Conclude(resp.content().trim()), resp);
    }

    @Override
    public PlanDraft draft(PlanningRequest request) {
        if (request.capabilities().isEmpty()) {
            throw new OracleFailureException("Cannot plan without capabilities");
        }
        var resp = call(new ChatRequest(model, prompts.draft(request), temperature));
        var steps = parsePlan(resp.content(), request.capabilities());
        boolean fallback = steps.isEmpty();
        if (fallback) {
            log.warn("Could not parse a plan from the model reply, falling back to a single step");
            steps = List.of(new PlanStep(request.capabilities().get(0).name(),
                    request.taskDescription() != null ? request.taskDescription() : request.taskTitle(),
                    FALLBACK_REASONING));
        }
        return new PlanDraft(steps, fallback, resp.model(),
                resp.usage().promptTokens(), resp.usage().completionTokens());
    }

    @Override
    public OracleDecision aggregate(PlanningRequest request) {
        var resp = call(new ChatRequest(model, prompts.aggregate(request), temperature));
        if (resp.content() == null || resp.content().isBlank()) {
            throw new OracleFailureException("Model returned an empty summary");
        }
        return decision(new Action.Conclude(resp.content().trim()), resp);
    }

    private ChatResponse call(ChatRequest request) {
        try {
            return provider.chat(request);
        } catch (RuntimeException e) {
            throw new OracleFailureException("Oracle call failed: " + e.getMessage(), e);
        }
    }

    private static OracleDecision decision(Action action, ChatResponse resp) {
        return new OracleDecision(action, resp.model(),
                resp.usage().promptTokens(), resp.usage().completionTokens());
    }

    private static List<Map<String, Object>> toolsDef(List<CapabilityDescriptor> capabilities) {
        var tools = new ArrayList<Map<String, Object>>();
        for (var c : capabilities) {
            var fn = new LinkedHashMap<String, Object>();
            fn.put("name", c.name());
            fn.put("description", c.description());
            fn.put("parameters", Map.of(
                    "type", "object",
                    "properties", Map.of("message", Map.of(
                            "type", "string",
                            "description", "The question or subtask to send to the agent")),
                    "required", List.of("message")));
            tools.add(Map.of("type", "function", "function", fn));
        }
        return tools.isEmpty() ? null : tools;
    }

    /** Raw arguments are passed through when they are not a JSON object with a message. */
    static String messageArgument(String argsJson) {
        if (argsJson == null || argsJson.isBlank()) return "";
        try {
            var node = MAPPER.readTree(argsJson);
            if (node.isObject() && node.has("message")) return node.get("message").asText();
            return argsJson;
        } catch (JsonProcessingException e) {
            return argsJson;
        }
    }

    /**
     * Reads {@code {"plan":[...]}} from the reply, also when it is wrapped in a fenced code
     * block. Steps may name the agent by function name or by agent id. Returns an empty
     * list when nothing usable was found.
     */
    static List<PlanStep> parsePlan(String content, List<CapabilityDescriptor> capabilities) {
        var root = readJson(content);
        if (root == null) root = readJson(fenced(content));
        if (root == null) return List.of();

        var byAgentId = new LinkedHashMap<String, String>();
        for (var c : capabilities) byAgentId.put(c.agentId(), c.name());

        var steps = new ArrayList<PlanStep>();
        for (var item : root.path("plan")) {
            var agent = text(item, "agent");
            if (agent == null) agent = text(item, "agent_id");
            var subtask = text(item, "subtask");
            if (agent == null || subtask == null) continue;
            steps.add(new PlanStep(byAgentId.getOrDefault(agent, agent), subtask, text(item, "reasoning")));
        }
        return steps;
    }

    private static JsonNode readJson(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            var node = MAPPER.readTree(s.trim());
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String fenced(String content) {
        if (content == null) return null;
        int start = content.indexOf("```json");
        int bodyStart;
        if (start >= 0) {
            bodyStart = start + "```json".length();
        } else {
            start = content.indexOf("```");
            if (start < 0) return null;
            bodyStart = start + 3;
        }
        int end = content.indexOf("```", bodyStart);
        return end < 0 ? null : content.substring(bodyStart, end);
    }

    private static String text(JsonNode node, String field) {
        var v = node.path(field);
        return v.isTextual() && !v.asText().isBlank() ? v.asText() : null;
    }
}
