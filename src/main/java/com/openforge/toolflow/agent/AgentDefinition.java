package com.openforge.toolflow.agent;

import java.util.List;

/**
 * A named agent: a role prompt plus the tool names it may use.
 */
public record AgentDefinition(
        String name,
        String description,
        String rolePrompt,
        List<String> tools
) {

    public AgentDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agent name must not be blank");
        }
        description = description == null ? "" : description;
        rolePrompt = rolePrompt == null ? "" : rolePrompt;
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public AgentDefinition withTools(List<String> newTools) {
        return new AgentDefinition(name, description, rolePrompt, newTools);
    }
}
