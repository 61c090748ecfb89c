package com.openforge.toolflow.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StepType {

    TOOL_CALL("tool_call"),
    AGENT_CALL("agent_call"),
    CONDITION("condition");

    private final String value;

    StepType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static StepType fromValue(String value) {
        for (StepType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown step type: " + value);
    }
}
