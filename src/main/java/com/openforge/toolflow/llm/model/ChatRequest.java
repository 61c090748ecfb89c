package com.openforge.toolflow.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Body of a /chat/completions call.  Null fields are left out of the JSON, so
 * a request without tools carries neither "tools" nor "tool_choice"; the
 * router fills in {@code model} per provider.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Integer maxTokens,
        List<String> stop
) {

    public static ChatRequest simple(List<Message> messages, Integer maxTokens, Double temperature,
                                     List<String> stop) {
        return ChatRequest.builder()
                .messages(messages)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .stop(stop == null || stop.isEmpty() ? null : stop)
                .build();
    }

    public static ChatRequest withTools(List<Message> messages, List<Tool> tools, Integer maxTokens,
                                        Double temperature, List<String> stop) {
        boolean hasTools = tools != null && !tools.isEmpty();
        return ChatRequest.builder()
                .messages(messages)
                .tools(hasTools ? tools : null)
                .toolChoice(hasTools ? "auto" : null)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .stop(stop == null || stop.isEmpty() ? null : stop)
                .build();
    }
}
