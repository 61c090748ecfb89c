package com.openforge.toolflow.llm;

import com.openforge.toolflow.config.AppConfig;
import com.openforge.toolflow.llm.model.ChatRequest;
import com.openforge.toolflow.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class LlmRouterTest {

    private static final ChatRequest REQUEST = ChatRequest.simple(List.of(Message.user("hi")), 16, 0.0, null);
    private static final String OK_BODY = """
            {"choices":[{"index":0,"message":{"role":"assistant","content":"from fallback"},"finish_reason":"stop"}]}""";

    private HttpClient httpClient;
    private HttpResponse<String> okResponse;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        httpClient = mock(HttpClient.class);
        okResponse = mock(HttpResponse.class);
        when(okResponse.statusCode()).thenReturn(200);
        when(okResponse.body()).thenReturn(OK_BODY);
    }

    private static LlmProperties.ProviderConfig provider(String name, String baseUrl) {
        return new LlmProperties.ProviderConfig(name, baseUrl, null, name + "-model", 5);
    }

    private LlmRouter router(LlmProperties.ProviderConfig fallback) {
        Retry noRetry = Retry.of("test", RetryConfig.custom().maxAttempts(1).build());
        return new LlmRouter(httpClient, new AppConfig().objectMapper(),
                new LlmProperties(provider("primary", "http://primary.test/v1"), fallback,
                        LlmProperties.Resilience.defaults()),
                CircuitBreaker.ofDefaults("primary"), CircuitBreaker.ofDefaults("fallback"), noRetry, noRetry);
    }

    private static boolean isFor(HttpRequest request, String host) {
        return request != null && host.equals(request.uri().getHost());
    }

    @Test
    void shouldFailOverToFallbackProvider() throws Exception {
        doThrow(new IOException("refused")).when(httpClient)
                .send(argThat(request -> isFor(request, "primary.test")), any());
        doReturn(okResponse).when(httpClient)
                .send(argThat(request -> isFor(request, "fallback.test")), any());

        LlmRouter router = router(provider("fallback", "http://fallback.test/v1"));

        assertEquals("from fallback", router.chat(REQUEST).text());
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(2)).send(captor.capture(), any());
        assertEquals("fallback.test", captor.getAllValues().get(1).uri().getHost());
    }

    @Test
    void shouldThrowWhenPrimaryFailsWithoutFallback() throws Exception {
        doThrow(new IOException("refused")).when(httpClient).send(any(HttpRequest.class), any());

        LlmRouter router = router(null);

        assertThrows(LlmClient.LlmException.class, () -> router.chat(REQUEST));
        verify(httpClient, times(1)).send(any(HttpRequest.class), any());
    }

    @Test
    void shouldIgnoreUnconfiguredFallback() throws Exception {
        doThrow(new IOException("refused")).when(httpClient).send(any(HttpRequest.class), any());

        LlmRouter router = router(provider("fallback", ""));

        assertThrows(LlmClient.LlmException.class, () -> router.chat(REQUEST));
        verify(httpClient, times(1)).send(any(HttpRequest.class), any());
    }

    @Test
    void shouldReportPrimaryModelName() {
        assertEquals("primary-model", router(null).modelName());
    }
}
