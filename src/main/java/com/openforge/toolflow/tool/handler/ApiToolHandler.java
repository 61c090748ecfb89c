package com.openforge.toolflow.tool.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolExecutionException;
import com.openforge.toolflow.tool.ToolProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Handler for {@code api} tools.
 *
 * Resolution order, call-time values first:
 *   url     : parameter "url", config "url", config "base_url"
 *   method  : parameter "method", config "method", GET
 *   headers : config "headers" overlaid with parameter "headers"
 *   payload : parameter "data", else every parameter except url/method/headers
 *
 * GET/DELETE/HEAD send the payload as a query string; POST/PUT/PATCH as a JSON body.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiToolHandler {

    private static final Set<String> BODY_METHODS  = Set.of("POST", "PUT", "PATCH");
    private static final Set<String> CONTROL_KEYS  = Set.of("url", "method", "headers", "data");
    private static final int         ERROR_BODY_MAX = 500;

    private final HttpClient     httpClient;
    private final ObjectMapper   objectMapper;
    private final ToolProperties properties;

    public Map<String, Object> execute(ToolDescriptor tool, Map<String, Object> parameters) {
        Map<String, Object> config = tool.config();

        String url = Values.firstNonBlank(
                Values.string(parameters.get("url")),
                Values.string(config.get("url")),
                Values.string(config.get("base_url")));
        if (url == null) {
            throw new ToolExecutionException("URL is required for API calls");
        }
        String method = Values.firstNonBlank(
                Values.string(parameters.get("method")),
                Values.string(config.get("method")),
                "GET").toUpperCase(Locale.ROOT);

        Map<String, String> headers = new LinkedHashMap<>();
        Values.map(config.get("headers")).forEach((k, v) -> headers.put(k, String.valueOf(v)));
        Values.map(parameters.get("headers")).forEach((k, v) -> headers.put(k, String.valueOf(v)));

        Object payload = parameters.containsKey("data") ? parameters.get("data") : payloadFrom(parameters);
        long timeoutSeconds = Values.longValue(config.get("timeout_seconds"),
                Values.longValue(config.get("timeout"), properties.api().timeoutSeconds()));

        HttpRequest request = buildRequest(url, method, headers, payload, timeoutSeconds);
        log.debug("[ApiTool:{}] → {} {}", tool.name(), method, request.uri());

        HttpResponse<String> response = send(tool, request);
        int status = response.statusCode();
        String body = response.body();
        log.debug("[ApiTool:{}] ← HTTP {}", tool.name(), status);

        if (status < 200 || status >= 300) {
            throw new ToolExecutionException("API call failed: HTTP %d from %s: %s"
                    .formatted(status, url, truncate(body)));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status_code", status);
        result.put("data", parseBody(body));
        result.put("headers", flattenHeaders(response.headers().map()));
        return result;
    }

    // ── Request building ─────────────────────────────────────────────────────

    private HttpRequest buildRequest(String url, String method, Map<String, String> headers,
                                     Object payload, long timeoutSeconds) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .timeout(Duration.ofSeconds(timeoutSeconds));
        headers.forEach(builder::header);

        if (BODY_METHODS.contains(method)) {
            if (headers.keySet().stream().noneMatch("Content-Type"::equalsIgnoreCase)) {
                builder.header("Content-Type", "application/json");
            }
            builder.uri(URI.create(url))
                    .method(method, HttpRequest.BodyPublishers.ofString(toJson(payload)));
        } else {
            builder.uri(URI.create(withQuery(url, payload)))
                    .method(method, HttpRequest.BodyPublishers.noBody());
        }
        return builder.build();
    }

    private static Map<String, Object> payloadFrom(Map<String, Object> parameters) {
        Map<String, Object> payload = new LinkedHashMap<>(parameters);
        CONTROL_KEYS.forEach(payload::remove);
        return payload;
    }

    private static String withQuery(String url, Object payload) {
        if (!(payload instanceof Map<?, ?> query) || query.isEmpty()) {
            return url;
        }
        StringJoiner joiner = new StringJoiner("&");
        query.forEach((key, value) -> {
            if (value instanceof List<?> values) {
                values.forEach(v -> joiner.add(encode(key) + "=" + encode(v)));
            } else if (value != null) {
                joiner.add(encode(key) + "=" + encode(value));
            }
        });
        if (joiner.length() == 0) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + joiner;
    }

    private static String encode(Object value) {
        return URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8);
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Failed to serialize request body: " + e.getOriginalMessage(), e);
        }
    }

    // ── Response handling ────────────────────────────────────────────────────

    private HttpResponse<String> send(ToolDescriptor tool, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("API call interrupted: " + request.uri(), e);
        } catch (IOException e) {
            log.warn("[ApiTool:{}] Network error calling {}: {}", tool.name(), request.uri(), e.toString());
            throw new ToolExecutionException("API call failed: " + e, e);
        }
    }

    /** JSON when the body parses as JSON, otherwise the raw text. */
    private Object parseBody(String body) {
        if (body == null || body.isBlank()) {
            return body;
        }
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            return body;
        }
    }

    private static Map<String, String> flattenHeaders(Map<String, List<String>> headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> flat.put(name, String.join(", ", values)));
        }
        return flat;
    }

    private static String truncate(String body) {
        if (body == null) return "";
        return body.length() <= ERROR_BODY_MAX ? body : body.substring(0, ERROR_BODY_MAX) + "...";
    }
}
