package com.openforge.toolflow.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Conversation message in the OpenAI wire format.  Assistant messages carry
 * either text or {@code tool_calls}; tool messages answer one call through
 * {@code tool_call_id}.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content,
        List<ToolCall> toolCalls,
        String toolCallId
) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    public static Message system(String content) {
        return Message.builder().role(SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(USER).content(content).build();
    }

    public static Message assistantText(String content) {
        return Message.builder().role(ASSISTANT).content(content).build();
    }

    /** Some backends reject a null content next to tool_calls, so it is sent as "". */
    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder().role(ASSISTANT)
                .content(content == null ? "" : content)
                .toolCalls(toolCalls)
                .build();
    }

    public static Message toolResult(String toolCallId, String result) {
        return Message.builder().role(TOOL).toolCallId(toolCallId).content(result).build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
