package com.openforge.toolflow.agent.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request body for POST /api/agents/{name}/invoke.
 *
 * @param useTools     false forces a single basic completion (default true)
 * @param maxToolCalls tool-round budget; the configured default when null
 * @param toolForUse   optional: narrow the agent's tools to this one
 * @param textMode     use the text-marker tool protocol instead of native function calling
 * @param sessionId    echoed back in the metadata
 * @param clientId     registry scope the agent's tools are resolved in
 */
public record AgentInvocationRequest(

        @NotBlank(message = "prompt must not be blank")
        String prompt,

        @Min(value = 1, message = "max_tokens must be positive")
        Integer maxTokens,

        Double temperature,

        List<String> stop,

        Boolean useTools,

        @Min(value = 0, message = "max_tool_calls must not be negative")
        @Max(value = 20, message = "max_tool_calls must not exceed 20")
        Integer maxToolCalls,

        String toolForUse,

        Boolean textMode,

        String sessionId,

        String clientId
) {

    public static AgentInvocationRequest of(String prompt, Integer maxTokens, Double temperature,
                                            List<String> stop, boolean useTools, Integer maxToolCalls) {
        return new AgentInvocationRequest(prompt, maxTokens, temperature, stop, useTools, maxToolCalls,
                null, false, null, null);
    }
}
