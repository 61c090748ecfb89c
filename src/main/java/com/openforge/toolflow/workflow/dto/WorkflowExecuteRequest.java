package com.openforge.toolflow.workflow.dto;

import java.util.Map;

/** Request body for POST /api/workflows/{name}/execute: the initial context. */
public record WorkflowExecuteRequest(Map<String, Object> context) {

    public Map<String, Object> contextOrEmpty() {
        return context == null ? Map.of() : context;
    }
}
