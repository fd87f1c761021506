package com.flagship.shipping_workflow.session;

import com.flagship.shipping_workflow.observability.WorkflowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Archives, then deletes, with no transaction around the pair.
 *
 * A crash between the two steps leaves an archived record next to a live
 * session. The session then expires by TTL, and a retried hand-off writes a
 * second archive row with a new id.
 */
@RequiredArgsConstructor
@Slf4j
public class SequentialFinalization implements FinalizationStrategy {

    private final WorkflowMetrics metrics;

    @Override
    public void finalizeSession(String userKey, Runnable archive, Runnable delete) {
        log.warn("Finalizing session without a transaction, archive and delete are not atomic: userKey={}", userKey);
        archive.run();
        delete.run();
        metrics.recordFinalization(name());
    }

    @Override
    public boolean isAtomic() {
        return false;
    }

    @Override
    public String name() {
        return "sequential";
    }
}
