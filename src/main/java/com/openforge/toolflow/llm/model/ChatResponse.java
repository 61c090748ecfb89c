package com.openforge.toolflow.llm.model;

import java.util.List;

/**
 * Non-streaming /chat/completions response.  Only the first choice is used.
 */
public record ChatResponse(
        String id,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** @throws IllegalStateException when the backend returned no choices */
    public Message firstMessage() {
        Message message = firstOrNull();
        if (message == null) {
            throw new IllegalStateException("Chat completion %s has no choices".formatted(id));
        }
        return message;
    }

    public boolean hasToolCalls() {
        Message message = firstOrNull();
        return message != null && message.hasToolCalls();
    }

    /** Text of the first choice; empty when there is none. */
    public String text() {
        Message message = firstOrNull();
        return message == null || message.content() == null ? "" : message.content();
    }

    public static ChatResponse ofMessage(Message message) {
        String finishReason = message.hasToolCalls() ? "tool_calls" : "stop";
        return new ChatResponse(null, null, List.of(new Choice(0, message, finishReason)), null);
    }

    private Message firstOrNull() {
        return choices == null || choices.isEmpty() ? null : choices.get(0).message();
    }

    public record Choice(int index, Message message, String finishReason) {}

    public record Usage(int promptTokens, int completionTokens, int totalTokens) {}
}
