package com.openforge.toolflow.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a workflow definition and of a single execution:
 * DEFINED → RUNNING → COMPLETED | FAILED.  Executions never report DEFINED.
 */
public enum WorkflowStatus {

    DEFINED("defined"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    WorkflowStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
