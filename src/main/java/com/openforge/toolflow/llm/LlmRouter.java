package com.openforge.toolflow.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolflow.llm.model.ChatRequest;
import com.openforge.toolflow.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Sends chat requests down an ordered provider chain: the primary provider,
 * then the fallback provider when one is configured.
 *
 *   chat(request)
 *     for each provider:
 *       circuitBreaker( retry( client.chat(request with provider model) ) )
 *       success → return
 *       failure → log, try the next provider
 *     all failed → LlmException
 *
 * Callers turn the final {@link LlmClient.LlmException} into a fallback-mode answer.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    private final List<Provider> providers = new ArrayList<>(2);

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        providers.add(new Provider("primary", new LlmClient(httpClient, objectMapper, properties.primary()),
                primaryLlmCircuitBreaker, primaryLlmRetry));
        if (properties.fallback() != null && properties.fallback().isConfigured()) {
            providers.add(new Provider("fallback", new LlmClient(httpClient, objectMapper, properties.fallback()),
                    fallbackLlmCircuitBreaker, fallbackLlmRetry));
        }
    }

    /**
     * @throws LlmClient.LlmException when every provider failed
     */
    public ChatResponse chat(ChatRequest request) {
        LlmClient.LlmException last = null;
        for (Provider provider : providers) {
            ChatRequest routed = request.toBuilder().model(provider.client().modelName()).build();
            Supplier<ChatResponse> call = CircuitBreaker.decorateSupplier(provider.circuitBreaker(),
                    Retry.decorateSupplier(provider.retry(), () -> provider.client().chat(routed)));
            try {
                return call.get();
            } catch (RuntimeException e) {
                last = new LlmClient.LlmException(
                        "%s provider failed: %s".formatted(provider.label(), e.getMessage()), e);
                log.warn("[LlmRouter] {} provider [{}] failed ({}): {}", provider.label(),
                        provider.client().providerName(), e.getClass().getSimpleName(), e.getMessage());
            }
        }
        throw last;
    }

    /** Model of the primary provider, reported in fallback answers. */
    public String modelName() {
        return providers.get(0).client().modelName();
    }

    private record Provider(String label, LlmClient client, CircuitBreaker circuitBreaker, Retry retry) {}
}
