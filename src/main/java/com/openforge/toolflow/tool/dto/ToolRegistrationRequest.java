package com.openforge.toolflow.tool.dto;

import com.openforge.toolflow.tool.ToolDescriptor;
import com.openforge.toolflow.tool.ToolKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Request body for POST /api/tools.
 *
 * @param toolType  one of api, calculation, function, database
 * @param clientId  optional registry scope
 */
public record ToolRegistrationRequest(

        @NotBlank(message = "name must not be blank")
        @Size(max = 128, message = "name must not exceed 128 characters")
        String name,

        String description,

        Map<String, Object> parametersSchema,

        @NotBlank(message = "tool_type must not be blank")
        String toolType,

        Map<String, Object> config,

        String clientId
) {

    /** @throws IllegalArgumentException for an unknown tool type */
    public ToolDescriptor toDescriptor() {
        return new ToolDescriptor(name, description, parametersSchema, ToolKind.fromValue(toolType), config);
    }
}
