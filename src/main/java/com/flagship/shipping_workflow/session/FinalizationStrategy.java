package com.flagship.shipping_workflow.session;

/**
 * How a session hand-off (archive, then delete) is executed.
 *
 * Chosen once at startup from the capabilities of the backing database.
 */
public interface FinalizationStrategy {

    /**
     * Runs the archive step and then the delete step.
     */
    void finalizeSession(String userKey, Runnable archive, Runnable delete);

    /**
     * Whether both steps commit or fail together.
     */
    boolean isAtomic();

    String name();
}
