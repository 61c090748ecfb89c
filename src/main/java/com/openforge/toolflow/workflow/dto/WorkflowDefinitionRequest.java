package com.openforge.toolflow.workflow.dto;

import com.openforge.toolflow.workflow.WorkflowStep;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request body for POST /api/workflows.
 *
 * Example:
 * {
 *   "name": "echo",
 *   "steps": [ { "name": "say", "type": "tool_call", "tool_name": "echo",
 *                "parameters": { "msg": "{{input}}" } } ]
 * }
 */
public record WorkflowDefinitionRequest(

        @NotBlank(message = "name must not be blank")
        String name,

        @NotEmpty(message = "steps must not be empty")
        List<WorkflowStep> steps
) {}
