package com.openforge.toolflow.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Entry of the request's "tools" array: {@code {"type": "function", "function": {...}}}.
 * The parameter schema is a JsonNode so the registered schema goes out verbatim.
 */
public record Tool(String type, Function function) {

    public static Tool function(String name, String description, JsonNode parameters) {
        return new Tool("function", new Function(name, description, parameters));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Function(String name, String description, JsonNode parameters) {}
}
