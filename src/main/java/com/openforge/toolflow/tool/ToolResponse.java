package com.openforge.toolflow.tool;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Uniform outcome of one tool execution.  Exactly one of result / errorMessage
 * is meaningful, selected by {@code success}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResponse(
        boolean success,
        Object result,
        String errorMessage,
        double executionTimeMs
) {

    public static ToolResponse ok(Object result, double executionTimeMs) {
        return new ToolResponse(true, result, null, executionTimeMs);
    }

    public static ToolResponse error(String errorMessage, double executionTimeMs) {
        return new ToolResponse(false, null, errorMessage, executionTimeMs);
    }
}
