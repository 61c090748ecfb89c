package com.openforge.toolflow.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Orchestration defaults, bound from "agent.orchestration":
 *
 * agent:
 *   orchestration:
 *     default-max-tool-calls: 3
 *     default-max-tokens: 1024
 *     default-temperature: 0.7
 *     system-prompt: "You are a helpful assistant..."
 *
 * Request fields left empty fall back to these values.
 */
@ConfigurationProperties(prefix = "agent.orchestration")
public record OrchestrationProperties(
        @DefaultValue("3") int defaultMaxToolCalls,
        @DefaultValue("1024") int defaultMaxTokens,
        @DefaultValue("0.7") double defaultTemperature,
        @DefaultValue("You are a helpful assistant that can use tools. Decide whether a tool is needed. "
                + "If so, emit a tool call. Otherwise, output the final answer.")
        String systemPrompt
) {

    public static OrchestrationProperties defaults() {
        return new OrchestrationProperties(3, 1024, 0.7,
                "You are a helpful assistant that can use tools. Decide whether a tool is needed. "
                        + "If so, emit a tool call. Otherwise, output the final answer.");
    }
}
