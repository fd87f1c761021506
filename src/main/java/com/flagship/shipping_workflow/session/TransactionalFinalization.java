package com.flagship.shipping_workflow.session;

import com.flagship.shipping_workflow.observability.WorkflowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Archives and deletes inside a single database transaction.
 */
@RequiredArgsConstructor
@Slf4j
public class TransactionalFinalization implements FinalizationStrategy {

    private final TransactionTemplate transactionTemplate;
    private final WorkflowMetrics metrics;

    @Override
    public void finalizeSession(String userKey, Runnable archive, Runnable delete) {
        transactionTemplate.executeWithoutResult(status -> {
            archive.run();
            delete.run();
        });
        metrics.recordFinalization(name());
        log.debug("Session finalized in one transaction: userKey={}", userKey);
    }

    @Override
    public boolean isAtomic() {
        return true;
    }

    @Override
    public String name() {
        return "transactional";
    }
}
