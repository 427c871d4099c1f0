package com.agentcrew.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Base for providers that speak the {@code /chat/completions} protocol. Handles both a
 * plain JSON body and a server-sent-event stream, since some gateways always stream.
 */
public abstract class OpenAiCompatibleProvider implements ModelProvider {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String apiKey;
    private final String baseUrl;
    private final String defaultModel;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    protected OpenAiCompatibleProvider(String apiKey, String baseUrl, String defaultModel) {
        this(apiKey, baseUrl, defaultModel, DEFAULT_TIMEOUT);
    }

    protected OpenAiCompatibleProvider(String apiKey, String baseUrl, String defaultModel, Duration requestTimeout) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.defaultModel = defaultModel;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public String defaultModel() {
        return defaultModel;
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        try {
            return doChat(request);
        } catch (IOException e) {
            throw new RuntimeException("Model API unreachable at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while calling model API", e);
        }
    }

    private ChatResponse doChat(ChatRequest request) throws IOException, InterruptedException {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", request.model() != null ? request.model() : defaultModel);
        body.put("messages", request.messages());
        body.put("temperature", request.temperature());
        if (request.tools() != null && !request.tools().isEmpty()) {
            body.put("tools", request.tools());
        }

        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }

        var resp = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new ModelApiException(resp.statusCode(), resp.body());
        }

        var respBody = resp.body().trim();
        if (respBody.startsWith("{")) {
            return parseResponse(mapper.readTree(respBody));
        }
        return parseSse(respBody);
    }

    private ChatResponse parseResponse(JsonNode root) {
        var message = root.path("choices").path(0).path("message");
        var toolCalls = new ArrayList<ToolCallInfo>();
        var tcNode = message.path("tool_calls");
        if (tcNode.isArray()) {
            for (var tc : tcNode) {
                var fn = tc.path("function");
                toolCalls.add(new ToolCallInfo(
                        tc.path("id").asText(),
                        fn.path("name").asText(),
                        fn.path("arguments").asText("")));
            }
        }
        var content = message.path("content").asText(null);
        return new ChatResponse(root.path("model").asText(null),
                content != null ? content : "", usage(root.path("usage")), toolCalls);
    }

    private ChatResponse parseSse(String sse) throws IOException {
        var content = new StringBuilder();
        String model = null;
        var usage = TokenUsage.NONE;
        // stream index -> {id, name}; argument fragments accumulate separately
        var callHeads = new LinkedHashMap<Integer, String[]>();
        var callArgs = new LinkedHashMap<Integer, StringBuilder>();

        for (var line : sse.split("\n")) {
            line = line.trim();
            if (!line.startsWith("data:")) continue;
            var data = line.substring(5).trim();
            if ("[DONE]".equals(data)) break;

            var node = mapper.readTree(data);
            if (model == null) model = node.path("model").asText(null);
            if (node.path("usage").has("prompt_tokens")) usage = usage(node.path("usage"));

            var delta = node.path("choices").path(0).path("delta");
            var text = delta.path("content").asText(null);
            if (text != null) content.append(text);

            for (var tc : delta.path("tool_calls")) {
                int idx = tc.path("index").asInt(0);
                var id = tc.path("id").asText(null);
                if (id != null && !callHeads.containsKey(idx)) {
                    callHeads.put(idx, new String[]{id, tc.path("function").path("name").asText(null)});
                    callArgs.put(idx, new StringBuilder());
                }
                var args = tc.path("function").path("arguments").asText(null);
                if (args != null && callArgs.containsKey(idx)) callArgs.get(idx).append(args);
            }
        }

        var toolCalls = new ArrayList<ToolCallInfo>();
        callHeads.forEach((idx, head) -> toolCalls.add(new ToolCallInfo(head[0], head[1], callArgs.get(idx).toString())));
        return new ChatResponse(model, content.toString(), usage, toolCalls);
    }

    private static TokenUsage usage(JsonNode u) {
        return new TokenUsage(u.path("prompt_tokens").asInt(0), u.path("completion_tokens").asInt(0));
    }
}
