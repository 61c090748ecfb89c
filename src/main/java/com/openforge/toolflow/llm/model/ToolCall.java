package com.openforge.toolflow.llm.model;

/**
 * One call the model asked for.  {@code arguments} arrives as a JSON string and
 * may be malformed; parsing is left to the orchestrator.
 */
public record ToolCall(String id, String type, FunctionCall function) {

    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, "function", new FunctionCall(name, arguments));
    }

    public ToolCall withId(String newId) {
        return new ToolCall(newId, type, function);
    }

    /** Null-safe name of the requested function. */
    public String functionName() {
        return function == null ? null : function.name();
    }

    public record FunctionCall(String name, String arguments) {}
}
