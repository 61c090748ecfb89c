package com.openforge.toolflow.agent;

import java.util.Map;

/**
 * Trace of one tool call requested by the model.
 * {@code result} is set on success, {@code error} otherwise.
 */
public record ToolInvocation(
        String tool,
        Map<String, Object> arguments,
        Object result,
        String error,
        boolean success
) {

    public static ToolInvocation succeeded(String tool, Map<String, Object> arguments, Object result) {
        return new ToolInvocation(tool, arguments, result, null, true);
    }

    public static ToolInvocation failed(String tool, Map<String, Object> arguments, String error) {
        return new ToolInvocation(tool, arguments, null, error, false);
    }
}
