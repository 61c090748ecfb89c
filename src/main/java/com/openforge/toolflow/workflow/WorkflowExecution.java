package com.openforge.toolflow.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of one finished workflow run.
 *
 * @param context the shared context as it stood when the run ended
 * @param error   the failing step's error; null when completed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowExecution(
        String executionId,
        String workflowName,
        WorkflowStatus status,
        List<StepResult> steps,
        Map<String, Object> context,
        String error,
        Instant startTime,
        Instant endTime
) {

    public boolean succeeded() {
        return status == WorkflowStatus.COMPLETED;
    }
}
