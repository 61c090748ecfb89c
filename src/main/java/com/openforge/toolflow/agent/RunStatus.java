package com.openforge.toolflow.agent;

import com.fasterxml.jackson.annotation.JsonValue;

/** How an orchestration run ended; reported as metadata "status". */
public enum RunStatus {

    COMPLETED("completed"),
    MAX_ITERATIONS_REACHED("max_iterations_reached"),
    FALLBACK("fallback");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
