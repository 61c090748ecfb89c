package com.openforge.toolflow.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolflow.llm.model.ChatRequest;
import com.openforge.toolflow.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Blocking client for one OpenAI-compatible provider.  Not a Spring bean: the
 * {@link LlmRouter} creates one per configured provider.
 *
 * Every failure surfaces as {@link LlmException} (429 as
 * {@link LlmRateLimitException}) so that the router's retry can react to it.
 */
@Slf4j
public class LlmClient {

    private final HttpClient                   httpClient;
    private final ObjectMapper                 objectMapper;
    private final LlmProperties.ProviderConfig config;
    private final URI                          endpoint;

    public LlmClient(HttpClient httpClient, ObjectMapper objectMapper, LlmProperties.ProviderConfig config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
        this.endpoint     = URI.create(stripSlash(config.baseUrl()) + "/chat/completions");
    }

    public ChatResponse chat(ChatRequest request) {
        if (request.model() == null || request.model().isBlank()) {
            request = request.toBuilder().model(config.model()).build();
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new LlmException("Cannot serialize chat request", e);
        }

        HttpRequest.Builder http = HttpRequest.newBuilder(endpoint)
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            http.header("Authorization", "Bearer " + config.apiKey());
        }

        log.debug("[LlmClient:{}] POST {} ({} messages, tools={})", config.name(), endpoint,
                request.messages() == null ? 0 : request.messages().size(), request.tools() != null);
        HttpResponse<String> response;
        try {
            response = httpClient.send(http.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]: %s".formatted(config.name(), e.getMessage()), e);
        }
        return read(response);
    }

    public String modelName() {
        return config.model();
    }

    public String providerName() {
        return config.name();
    }

    private ChatResponse read(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 429) {
            throw new LlmRateLimitException("Rate-limited by provider [%s]".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            throw new LlmException("Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, response.body()),
                    status);
        }
        try {
            return objectMapper.readValue(response.body(), ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException("Unparseable response from provider [%s]".formatted(config.name()), e);
        }
    }

    private static String stripSlash(String url) {
        if (url == null) {
            throw new IllegalArgumentException("LLM provider base-url is not configured");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ── Exception types ──────────────────────────────────────────────────────

    /**
     * Any failure talking to a provider.  {@link #statusCode()} is the HTTP
     * status when the provider answered, {@code -1} otherwise.
     */
    public static class LlmException extends RuntimeException {
        private final int statusCode;

        public LlmException(String message) { this(message, -1); }
        public LlmException(String message, int statusCode) { super(message); this.statusCode = statusCode; }
        public LlmException(String message, Throwable cause) { super(message, cause); this.statusCode = -1; }

        public int statusCode() {
            return statusCode;
        }

        /** False for client errors other than 429 and for interrupted calls. */
        public boolean isRetryable() {
            if (getCause() instanceof InterruptedException) {
                return false;
            }
            return statusCode == 429 || statusCode < 400 || statusCode >= 500;
        }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message, 429); }
    }
}
