package com.flagship.shipping_workflow.workflow;

import com.flagship.shipping_workflow.session.FieldPatch;
import lombok.Value;

/**
 * Outcome of evaluating input at a step: either the fields to write and the
 * step to move to, or a user-facing error and no change at all.
 */
@Value
public class StepResult {
    boolean accepted;
    FieldPatch patch;
    WorkflowStep nextStep;
    String error;

    public static StepResult accepted(FieldPatch patch, WorkflowStep nextStep) {
        return new StepResult(true, patch, nextStep, null);
    }

    public static StepResult rejected(String error) {
        return new StepResult(false, FieldPatch.empty(), null, error);
    }
}
