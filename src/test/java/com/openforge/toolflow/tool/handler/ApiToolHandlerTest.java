package com.openforge.toolflow.tool.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolExecutionException;
import com.openforge.toolflow.tool.ToolKind;
import com.openforge.toolflow.tool.ToolProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ApiToolHandlerTest {

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private ApiToolHandler handler;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        handler = new ApiToolHandler(httpClient, new ObjectMapper(), ToolProperties.defaults());

        when(response.headers()).thenReturn(HttpHeaders.of(
                Map.of("content-type", List.of("application/json")), (name, value) -> true));
        doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }

    private static ToolDescriptor apiTool(Map<String, Object> config) {
        return new ToolDescriptor("weather", "Weather lookup", null, ToolKind.API, config);
    }

    // ==================== Request building ====================

    @Test
    void shouldSendGetWithQueryStringFromRemainingParameters() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"temp\":21}");

        handler.execute(apiTool(Map.of("url", "http://api.test/weather")), Map.of("city", "Seoul"));

        HttpRequest request = sentRequest();
        assertEquals("GET", request.method());
        assertEquals("http://api.test/weather?city=Seoul", request.uri().toString());
    }

    @Test
    void shouldPreferParameterUrlAndMethodOverConfig() throws Exception {
        when(response.statusCode()).thenReturn(201);
        when(response.body()).thenReturn("");

        handler.execute(apiTool(Map.of("url", "http://config.test", "method", "GET")),
                Map.of("url", "http://param.test/items", "method", "post", "data", Map.of("id", 7)));

        HttpRequest request = sentRequest();
        assertEquals("POST", request.method());
        assertEquals("http://param.test/items", request.uri().toString());
        assertEquals("application/json", request.headers().firstValue("Content-Type").orElseThrow());
    }

    @Test
    void shouldFallBackToBaseUrl() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("ok");

        handler.execute(apiTool(Map.of("base_url", "http://base.test")), Map.of());

        assertEquals("http://base.test", sentRequest().uri().toString());
    }

    @Test
    void shouldOverlayParameterHeadersOnConfigHeaders() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{}");

        handler.execute(apiTool(Map.of("url", "http://api.test",
                        "headers", Map.of("X-Api-Key", "config", "X-Trace", "1"))),
                Map.of("headers", Map.of("X-Api-Key", "param")));

        HttpRequest request = sentRequest();
        assertEquals("param", request.headers().firstValue("X-Api-Key").orElseThrow());
        assertEquals("1", request.headers().firstValue("X-Trace").orElseThrow());
    }

    @Test
    void shouldUseConfiguredTimeout() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{}");

        handler.execute(apiTool(Map.of("url", "http://api.test", "timeout_seconds", 5)), Map.of());

        assertEquals(Duration.ofSeconds(5), sentRequest().timeout().orElseThrow());
    }

    // ==================== Response handling ====================

    @Test
    void shouldReturnStatusParsedJsonAndHeaders() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"temp\":21}");

        Map<String, Object> result = handler.execute(apiTool(Map.of("url", "http://api.test")), Map.of());

        assertEquals(200, result.get("status_code"));
        assertEquals(Map.of("temp", 21), result.get("data"));
        assertEquals(Map.of("content-type", "application/json"), result.get("headers"));
    }

    @Test
    void shouldReturnRawTextWhenBodyIsNotJson() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("plain text");

        Map<String, Object> result = handler.execute(apiTool(Map.of("url", "http://api.test")), Map.of());

        assertEquals("plain text", result.get("data"));
    }

    @Test
    void shouldFailOnNon2xxStatus() {
        when(response.statusCode()).thenReturn(500);
        when(response.body()).thenReturn("boom");

        ToolExecutionException error = assertThrows(ToolExecutionException.class,
                () -> handler.execute(apiTool(Map.of("url", "http://api.test")), Map.of()));

        assertTrue(error.getMessage().contains("HTTP 500"));
    }

    @Test
    void shouldFailOnNetworkError() throws Exception {
        doThrow(new IOException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());

        ToolExecutionException error = assertThrows(ToolExecutionException.class,
                () -> handler.execute(apiTool(Map.of("url", "http://api.test")), Map.of()));

        assertTrue(error.getMessage().startsWith("API call failed"));
    }

    @Test
    void shouldRequireUrl() {
        assertThrows(ToolExecutionException.class, () -> handler.execute(apiTool(Map.of()), Map.of()));
    }
}
