package com.openforge.toolflow.workflow;

import java.time.Instant;
import java.util.List;

/**
 * A named, ordered list of steps.  Only {@code status} changes after
 * definition; the steps are fixed.
 */
public record WorkflowDefinition(
        String name,
        List<WorkflowStep> steps,
        WorkflowStatus status,
        Instant createdAt
) {

    public WorkflowDefinition {
        steps = List.copyOf(steps);
    }

    public WorkflowDefinition withStatus(WorkflowStatus newStatus) {
        return new WorkflowDefinition(name, steps, newStatus, createdAt);
    }
}
