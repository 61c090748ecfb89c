package com.openforge.toolflow.config;

import com.openforge.toolflow.llm.LlmClient;
import com.openforge.toolflow.llm.LlmProperties;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class Resilience4jConfigTest {

    private Retry retry;
    private AtomicInteger attempts;

    @BeforeEach
    void setUp() {
        LlmProperties.Resilience resilience = new LlmProperties.Resilience(3, Duration.ofMillis(1), 1.0, 10, 50f,
                Duration.ofSeconds(60), Duration.ofSeconds(30));
        LlmProperties properties = new LlmProperties(null, null, resilience);
        retry = new Resilience4jConfig().primaryLlmRetry(new Resilience4jConfig().retryRegistry(properties));
        attempts = new AtomicInteger();
    }

    private void callFailingWith(LlmClient.LlmException error) {
        Supplier<String> call = Retry.decorateSupplier(retry, () -> {
            attempts.incrementAndGet();
            throw error;
        });
        assertThrows(LlmClient.LlmException.class, call::get);
    }

    // ==================== Retried ====================

    @Test
    void shouldRetryServerErrors() {
        callFailingWith(new LlmClient.LlmException("Provider [p] returned HTTP 503: busy", 503));

        assertEquals(3, attempts.get());
    }

    @Test
    void shouldRetryRateLimits() {
        callFailingWith(new LlmClient.LlmRateLimitException("Rate-limited by provider [p]"));

        assertEquals(3, attempts.get());
    }

    @Test
    void shouldRetryNetworkErrors() {
        callFailingWith(new LlmClient.LlmException("Network error", new IOException("reset")));

        assertEquals(3, attempts.get());
    }

    // ==================== Not retried ====================

    @Test
    void shouldNotRetryClientErrors() {
        callFailingWith(new LlmClient.LlmException("Provider [p] returned HTTP 401: bad key", 401));

        assertEquals(1, attempts.get());
    }

    @Test
    void shouldNotRetryInterruptedCalls() {
        callFailingWith(new LlmClient.LlmException("Interrupted", new InterruptedException()));

        assertEquals(1, attempts.get());
    }

    @Test
    void shouldOnlyTreatLlmExceptionsAsRetryable() {
        assertFalse(Resilience4jConfig.isRetryable(new IllegalStateException("no choices")));
        assertTrue(Resilience4jConfig.isRetryable(new LlmClient.LlmException("Unparseable response")));
    }
}
