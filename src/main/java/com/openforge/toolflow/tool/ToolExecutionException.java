package com.openforge.toolflow.tool;

/**
 * Raised by a kind handler when the side effect cannot be performed.
 * {@link DynamicToolExecutor} converts it into an error {@link ToolResponse}.
 */
public class ToolExecutionException extends RuntimeException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
