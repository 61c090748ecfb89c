package com.openforge.toolflow.agent.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request body for POST /api/generate: a prompt answered directly, or through
 * the text-marker tool loop over every tool of the client's scope.
 */
public record GenerateRequest(

        @NotBlank(message = "prompt must not be blank")
        String prompt,

        @Min(value = 1, message = "max_tokens must be positive")
        Integer maxTokens,

        Double temperature,

        List<String> stop,

        String clientId,

        Boolean useTools,

        @Min(value = 0, message = "max_tool_calls must not be negative")
        @Max(value = 20, message = "max_tool_calls must not exceed 20")
        Integer maxToolCalls
) {}
