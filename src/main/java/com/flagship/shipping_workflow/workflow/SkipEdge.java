package com.flagship.shipping_workflow.workflow;

import com.flagship.shipping_workflow.session.FieldPatch;
import lombok.Value;

import java.util.function.Supplier;

/**
 * Explicit "skip" transition of an optional step. The patch is produced at
 * skip time because some defaults (placeholder phones) are generated.
 */
@Value
public class SkipEdge {
    WorkflowStep target;
    Supplier<FieldPatch> patch;

    public StepResult take() {
        return StepResult.accepted(patch.get(), target);
    }
}
