package com.agentcrew.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.agentcrew.shared.model.AgentConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Talks to bots behind a Direct Line v3 style endpoint. The session token carries the
 * conversation id and the last watermark read, so passing it back continues the same
 * conversation from where the previous reply left off. The transport itself keeps no
 * per-conversation state.
 */
public class DirectLineTransport implements AgentTransport {

    private static final Logger log = LoggerFactory.getLogger(DirectLineTransport.class);
    private static final String USER_ID = "user";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String defaultEndpoint;
    private final int pollAttempts;
    private final Duration pollInterval;
    private final Duration requestTimeout;

    public DirectLineTransport(String defaultEndpoint, int pollAttempts, Duration pollInterval) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                defaultEndpoint, pollAttempts, pollInterval, Duration.ofSeconds(30));
    }

    public DirectLineTransport(HttpClient httpClient, String defaultEndpoint, int pollAttempts,
                               Duration pollInterval, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.defaultEndpoint = trimSlashes(defaultEndpoint);
        this.pollAttempts = Math.max(pollAttempts, 1);
        this.pollInterval = pollInterval;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public AgentReply send(AgentConnection connection, String message, String sessionToken) {
        var baseUrl = baseUrl(connection);
        Conversation conversation = null;
        boolean delivered = false;
        try {
            conversation = sessionToken != null
                    ? Conversation.fromToken(sessionToken)
                    : new Conversation(startConversation(baseUrl, connection), null);
            postActivity(baseUrl, connection, conversation.id, message);
            delivered = true;
            var reply = awaitReply(baseUrl, connection, conversation);
            return new AgentReply(reply, conversation.token());
        } catch (AgentUnavailableException e) {
            throw withProgress(e.getMessage(), e.getCause(), conversation, delivered);
        } catch (IOException e) {
            throw withProgress("Agent endpoint unreachable: " + baseUrl + ": " + e.getMessage(), e,
                    conversation, delivered);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw withProgress("Interrupted while waiting for agent " + connection.botId(), e,
                    conversation, delivered);
        }
    }

    @Override
    public AgentReply awaitReply(AgentConnection connection, String sessionToken) {
        var baseUrl = baseUrl(connection);
        var conversation = Conversation.fromToken(sessionToken);
        try {
            var reply = awaitReply(baseUrl, connection, conversation);
            return new AgentReply(reply, conversation.token());
        } catch (AgentUnavailableException e) {
            throw withProgress(e.getMessage(), e.getCause(), conversation, true);
        } catch (IOException e) {
            throw withProgress("Agent endpoint unreachable: " + baseUrl + ": " + e.getMessage(), e,
                    conversation, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw withProgress("Interrupted while waiting for agent " + connection.botId(), e,
                    conversation, true);
        }
    }

    private static AgentUnavailableException withProgress(String message, Throwable cause,
                                                          Conversation conversation, boolean delivered) {
        if (conversation != null) {
            log.debug("Call to conversation {} interrupted (delivered={})", conversation.id, delivered);
        }
        return new AgentUnavailableException(message, cause,
                conversation != null ? conversation.token() : null, delivered);
    }

    private String baseUrl(AgentConnection connection) {
        return connection.endpoint() != null && !connection.endpoint().isBlank()
                ? trimSlashes(connection.endpoint()) : defaultEndpoint;
    }

    private String startConversation(String baseUrl, AgentConnection connection)
            throws IOException, InterruptedException {
        var req = authorized(connection, baseUrl + "/conversations")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        checkStatus(resp, "start conversation");
        var id = mapper.readTree(resp.body()).path("conversationId").asText(null);
        if (id == null || id.isBlank()) {
            throw new AgentErrorException("Conversation start returned no conversationId");
        }
        log.debug("Started conversation {} with bot {}", id, connection.botId());
        return id;
    }

    private void postActivity(String baseUrl, AgentConnection connection, String conversationId, String message)
            throws IOException, InterruptedException {
        var body = new LinkedHashMap<String, Object>();
        body.put("type", "message");
        body.put("from", Map.of("id", USER_ID));
        body.put("text", message);
        if (connection.botId() != null) {
            body.put("channelData", Map.of("agentId", connection.botId()));
        }
        var req = authorized(connection, activitiesUrl(baseUrl, conversationId))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
        checkStatus(httpClient.send(req, HttpResponse.BodyHandlers.ofString()), "send message");
    }

    private String awaitReply(String baseUrl, AgentConnection connection, Conversation conversation)
            throws IOException, InterruptedException {
        for (int attempt = 0; attempt < pollAttempts; attempt++) {
            var url = activitiesUrl(baseUrl, conversation.id);
            if (conversation.watermark != null) {
                url += "?watermark=" + URLEncoder.encode(conversation.watermark, StandardCharsets.UTF_8);
            }
            var resp = httpClient.send(authorized(connection, url).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            checkStatus(resp, "read replies");

            var root = mapper.readTree(resp.body());
            var next = root.path("watermark").asText(null);
            if (next != null) conversation.watermark = next;

            var reply = latestBotText(root.path("activities"));
            if (reply != null) return reply;
            if (attempt < pollAttempts - 1) Thread.sleep(pollInterval.toMillis());
        }
        throw new AgentErrorException("No reply from agent " + connection.botId()
                + " after " + pollAttempts + " polls");
    }

    private static String latestBotText(JsonNode activities) {
        String latest = null;
        if (!activities.isArray()) return null;
        for (var activity : activities) {
            if (USER_ID.equals(activity.path("from").path("id").asText())) continue;
            if (!"message".equals(activity.path("type").asText("message"))) continue;
            latest = activity.path("text").asText("");
        }
        return latest;
    }

    private HttpRequest.Builder authorized(AgentConnection connection, String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Authorization", "Bearer " + connection.secret())
                .timeout(requestTimeout);
    }

    private static void checkStatus(HttpResponse<String> resp, String action) {
        int code = resp.statusCode();
        if (code >= 200 && code < 300) return;
        var msg = "Failed to " + action + ": HTTP " + code + ": " + resp.body();
        if (code >= 500 || code == 408 || code == 429) {
            throw new AgentUnavailableException(msg);
        }
        throw new AgentErrorException(msg);
    }

    private static String activitiesUrl(String baseUrl, String conversationId) {
        return baseUrl + "/conversations/" + URLEncoder.encode(conversationId, StandardCharsets.UTF_8) + "/activities";
    }

    private static String trimSlashes(String url) {
        return url == null ? null : url.replaceAll("/+$", "");
    }

    /** Conversation id plus read position, encoded as {@code id[@watermark]}. */
    static final class Conversation {
        final String id;
        String watermark;

        Conversation(String id, String watermark) {
            this.id = id;
            this.watermark = watermark;
        }

        static Conversation fromToken(String token) {
            int at = token.indexOf('@');
            if (at < 0) return new Conversation(decode(token), null);
            return new Conversation(decode(token.substring(0, at)), decode(token.substring(at + 1)));
        }

        String token() {
            var encoded = URLEncoder.encode(id, StandardCharsets.UTF_8);
            return watermark == null ? encoded
                    : encoded + "@" + URLEncoder.encode(watermark, StandardCharsets.UTF_8);
        }

        private static String decode(String part) {
            return URLDecoder.decode(part, StandardCharsets.UTF_8);
        }
    }
}
