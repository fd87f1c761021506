package com.flagship.shipping_workflow.workflow;

/**
 * Validates input at one step and decides the forward transition.
 *
 * Implementations are pure: no I/O, no session writes.
 */
@FunctionalInterface
public interface StepContract {

    StepResult evaluate(StepInput input);
}
