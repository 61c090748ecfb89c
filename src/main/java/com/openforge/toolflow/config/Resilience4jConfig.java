package com.openforge.toolflow.config;

import com.openforge.toolflow.llm.LlmClient;
import com.openforge.toolflow.llm.LlmProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry and circuit breaker per model provider, built from
 * {@code agent.llm.resilience}.  The instances "primaryLlm" and "fallbackLlm"
 * share one configuration but keep separate state, so an open primary circuit
 * does not block the fallback.
 */
@Configuration
public class Resilience4jConfig {

    static final String PRIMARY = "primaryLlm";
    static final String FALLBACK = "fallbackLlm";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(LlmProperties llmProperties) {
        LlmProperties.Resilience settings = settingsOf(llmProperties);
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.slidingWindowSize())
                .failureRateThreshold(settings.failureRateThreshold())
                .slowCallDurationThreshold(settings.slowCallThreshold())
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(settings.openStateWait())
                .build());
    }

    @Bean
    public RetryRegistry retryRegistry(LlmProperties llmProperties) {
        LlmProperties.Resilience settings = settingsOf(llmProperties);
        return RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.initialBackoff(), settings.backoffMultiplier()))
                .retryOnException(Resilience4jConfig::isRetryable)
                .build());
    }

    /** Network errors, 429 and 5xx are retried; other 4xx and interrupts are not. */
    static boolean isRetryable(Throwable error) {
        return error instanceof LlmClient.LlmException llm && llm.isRetryable();
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(PRIMARY);
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(FALLBACK);
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry(PRIMARY);
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry(FALLBACK);
    }

    private static LlmProperties.Resilience settingsOf(LlmProperties properties) {
        return properties.resilience() != null ? properties.resilience() : LlmProperties.Resilience.defaults();
    }
}
