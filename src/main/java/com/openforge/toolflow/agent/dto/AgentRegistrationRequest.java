package com.openforge.toolflow.agent.dto;

import com.openforge.toolflow.agent.AgentDefinition;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request body for POST /api/agents.
 */
public record AgentRegistrationRequest(

        @NotBlank(message = "name must not be blank")
        String name,

        String description,

        String rolePrompt,

        List<String> tools
) {

    public AgentDefinition toDefinition() {
        return new AgentDefinition(name, description, rolePrompt, tools);
    }
}
