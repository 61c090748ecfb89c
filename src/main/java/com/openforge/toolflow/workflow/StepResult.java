package com.openforge.toolflow.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/** Trace entry for one executed step: output on success, error otherwise. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepResult(
        String stepName,
        StepType stepType,
        boolean success,
        Map<String, Object> output,
        String error,
        Instant startTime,
        Instant endTime
) {

    static StepResult succeeded(WorkflowStep step, Map<String, Object> output, Instant start) {
        return new StepResult(step.name(), step.type(), true, output, null, start, Instant.now());
    }

    static StepResult failed(WorkflowStep step, String error, Instant start) {
        return new StepResult(step.name(), step.type(), false, null, error, start, Instant.now());
    }
}
