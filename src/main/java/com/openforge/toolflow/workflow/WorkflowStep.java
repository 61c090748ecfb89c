package com.openforge.toolflow.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a workflow, tagged by {@link StepType}:
 * <ul>
 *   <li>tool_call: {@code toolName} and templated {@code parameters}</li>
 *   <li>agent_call: {@code agentName} and a {@code promptTemplate}</li>
 *   <li>condition: a boolean {@code condition} expression over the context</li>
 * </ul>
 * Fields of the other variants are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowStep(
        String name,
        StepType type,
        String toolName,
        Map<String, Object> parameters,
        String agentName,
        String promptTemplate,
        String condition
) {

    public WorkflowStep {
        if (type == null) {
            throw new IllegalArgumentException("Step '%s' has no type".formatted(name));
        }
        if (name == null || name.isBlank()) {
            name = type.value();
        }
        switch (type) {
            case TOOL_CALL -> requireText(name, "tool_name", toolName);
            case AGENT_CALL -> requireText(name, "agent_name", agentName);
            case CONDITION -> requireText(name, "condition", condition);
        }
        if (type == StepType.TOOL_CALL) {
            parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        }
        if (type == StepType.AGENT_CALL && promptTemplate == null) {
            promptTemplate = "";
        }
    }

    public static WorkflowStep toolCall(String name, String toolName, Map<String, Object> parameters) {
        return new WorkflowStep(name, StepType.TOOL_CALL, toolName, parameters, null, null, null);
    }

    public static WorkflowStep agentCall(String name, String agentName, String promptTemplate) {
        return new WorkflowStep(name, StepType.AGENT_CALL, null, null, agentName, promptTemplate, null);
    }

    public static WorkflowStep condition(String name, String condition) {
        return new WorkflowStep(name, StepType.CONDITION, null, null, null, null, condition);
    }

    private static void requireText(String step, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Step '%s' requires %s".formatted(step, field));
        }
    }
}
