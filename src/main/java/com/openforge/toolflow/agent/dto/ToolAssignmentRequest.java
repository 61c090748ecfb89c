package com.openforge.toolflow.agent.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/** Request body for PUT /api/agents/{name}/tools; replaces the agent's tool list. */
public record ToolAssignmentRequest(
        @NotNull(message = "tool_names must not be null")
        List<String> toolNames
) {}
