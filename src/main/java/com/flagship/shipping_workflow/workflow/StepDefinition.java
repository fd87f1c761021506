package com.flagship.shipping_workflow.workflow;

import com.flagship.shipping_workflow.session.SessionField;
import lombok.Value;

import java.util.Optional;
import java.util.Set;

/**
 * One node of the step graph.
 */
@Value
public class StepDefinition {
    WorkflowStep step;
    StepContract contract;
    WorkflowStep forwardTarget;
    SkipEdge skipEdge;              // null when the step cannot be skipped
    WorkflowStep predecessor;
    Set<SessionField> writes;

    public Optional<SkipEdge> skip() {
        return Optional.ofNullable(skipEdge);
    }

    public boolean isSkippable() {
        return skipEdge != null;
    }
}
