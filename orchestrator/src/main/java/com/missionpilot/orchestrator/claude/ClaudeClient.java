package com.missionpilot.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Thin wrapper around the Anthropic Messages API over the JDK HttpClient.
 *
 * Overloaded and rate-limited responses (429, 503, 529) are retried with
 * exponential backoff; anything else non-200 raises {@link ClaudeApiException}.
 * The base URL is configurable so a proxy or a local stub can stand in.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** One conversation turn; reasoning calls are single-turn, so only user turns are built. */
    public record Message(String role, String content) {

        public static Message user(String content) {
            return new Message("user", content);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Reply(List<Block> content, @JsonProperty("stop_reason") String stopReason) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Block(String type, String text) {}

        String text() {
            if (content != null) {
                for (Block b : content) {
                    if ("text".equals(b.type()) && b.text() != null) return b.text();
                }
            }
            throw new IllegalStateException("No text block in reply (stop_reason " + stopReason + ")");
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String       API_VERSION     = "2023-06-01";
    private static final int          MAX_ATTEMPTS    = 4;
    private static final Duration     FIRST_BACKOFF   = Duration.ofSeconds(2);
    private static final Set<Integer> OVERLOADED      = Set.of(429, 503, 529);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final URI          endpoint;
    private final String       apiKey;
    private final int          maxTokens;
    private final Duration     requestTimeout;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                        @Value("${anthropic.max-tokens:4096}") int maxTokens,
                        @Value("${anthropic.request-timeout:120s}") Duration requestTimeout,
                        ObjectMapper objectMapper) {
        this.apiKey         = apiKey;
        this.endpoint       = URI.create(baseUrl.replaceAll("/+$", "") + "/v1/messages");
        this.maxTokens      = maxTokens;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * One Messages API call; returns the first text block of the reply.
     *
     * @param model    e.g. "claude-sonnet-4-5"
     * @param system   role prompt, or null
     * @param messages the conversation so far, ending with a user turn
     */
    public String complete(String model, String system, List<Message> messages) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model",      model);
        payload.put("max_tokens", maxTokens);
        if (system != null) payload.put("system", system);
        payload.put("messages",   messages);

        try {
            HttpRequest request = HttpRequest.newBuilder(endpoint)
                    .timeout(requestTimeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VERSION)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(payload)))
                    .build();
            HttpResponse<String> response = sendWithBackoff(request);
            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }
            return json.readValue(response.body(), Reply.class).text();
        } catch (IOException | IllegalStateException e) {
            throw new ClaudeApiException(-1, "Claude API call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClaudeApiException(-1, "interrupted");
        }
    }

    /** Resend while the API reports overload, doubling the pause each time. */
    private HttpResponse<String> sendWithBackoff(HttpRequest request) throws IOException, InterruptedException {
        Duration pause = FIRST_BACKOFF;
        for (int attempt = 1; ; attempt++) {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (!OVERLOADED.contains(response.statusCode()) || attempt == MAX_ATTEMPTS) {
                return response;
            }
            log.warn("Claude API returned {}; attempt {}/{}, next in {}s",
                    response.statusCode(), attempt, MAX_ATTEMPTS, pause.toSeconds());
            Thread.sleep(pause.toMillis());
            pause = pause.multipliedBy(2);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    /** statusCode is -1 when no HTTP response was received. */
    public static class ClaudeApiException extends RuntimeException {

        private final int statusCode;

        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }

        public ClaudeApiException(int statusCode, String message, Throwable cause) {
            super(message, cause);
            this.statusCode = statusCode;
        }

        public int statusCode() {
            return statusCode;
        }
    }
}
