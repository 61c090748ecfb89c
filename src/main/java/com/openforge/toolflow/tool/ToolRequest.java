package com.openforge.toolflow.tool;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Direct execution request: POST /api/tools/execute.
 *
 * @param toolName   registered tool name
 * @param parameters argument map passed to the tool
 * @param clientId   optional registry scope; the default scope when absent
 */
public record ToolRequest(
        @NotBlank(message = "tool_name must not be blank")
        String toolName,
        Map<String, Object> parameters,
        String clientId
) {

    public Map<String, Object> parametersOrEmpty() {
        return parameters == null ? Map.of() : parameters;
    }
}
