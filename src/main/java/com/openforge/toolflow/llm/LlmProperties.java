package com.openforge.toolflow.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Model backend configuration, bound from "agent.llm":
 *
 * agent:
 *   llm:
 *     primary:
 *       name: vllm
 *       base-url: http://localhost:8001/v1
 *       api-key: EMPTY
 *       model: Qwen/Qwen3-14B
 *       timeout-seconds: 120
 *     fallback:                 # optional, used when the primary keeps failing
 *       base-url: https://api.openai.com/v1
 *       model: gpt-4o-mini
 *     resilience:
 *       max-attempts: 3
 *       initial-backoff: 1s
 *       failure-rate-threshold: 50
 *       open-state-wait: 30s
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback,
        @DefaultValue Resilience resilience
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            @DefaultValue("120") int timeoutSeconds
    ) {

        /** A provider without a base URL is treated as not configured. */
        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }

    /** Retry and circuit-breaker settings, applied to each provider separately. */
    public record Resilience(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("1s") Duration initialBackoff,
            @DefaultValue("2.0") double backoffMultiplier,
            @DefaultValue("10") int slidingWindowSize,
            @DefaultValue("50") float failureRateThreshold,
            @DefaultValue("60s") Duration slowCallThreshold,
            @DefaultValue("30s") Duration openStateWait
    ) {

        public static Resilience defaults() {
            return new Resilience(3, Duration.ofSeconds(1), 2.0, 10, 50f,
                    Duration.ofSeconds(60), Duration.ofSeconds(30));
        }
    }
}
