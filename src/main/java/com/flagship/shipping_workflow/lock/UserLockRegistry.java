package com.flagship.shipping_workflow.lock;

import com.flagship.shipping_workflow.config.WorkflowProperties;
import com.flagship.shipping_workflow.observability.WorkflowMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion per user key.
 *
 * Locks are created on first use and kept for the life of the process; one
 * idle {@link ReentrantLock} per user ever seen. Operations for different users
 * never contend. Waiting is bounded by {@code workflow.lock.timeout}.
 *
 * Only serializes callers within this JVM. Cross-node safety relies on the
 * session store's atomic operations.
 */
@Component
@Slf4j
public class UserLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;
    private final WorkflowMetrics metrics;

    @Autowired
    public UserLockRegistry(WorkflowProperties properties, WorkflowMetrics metrics) {
        this(properties.getLock().getTimeout(), metrics);
    }

    public UserLockRegistry(Duration timeout, WorkflowMetrics metrics) {
        this.timeout = timeout;
        this.metrics = metrics;
        metrics.registerLockRegistryGauge(locks);
    }

    /**
     * Runs {@code action} while holding the lock for {@code userKey}.
     *
     * @throws LockTimeoutException if the lock is not acquired within the timeout
     *         or the waiting thread is interrupted; the action is not run
     */
    public <T> T withLock(String userKey, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(userKey, key -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordLockTimeout();
            throw new LockTimeoutException(userKey, e);
        }

        if (!acquired) {
            metrics.recordLockTimeout();
            log.warn("Lock wait timed out: userKey={}, timeoutMs={}", userKey, timeout.toMillis());
            throw new LockTimeoutException(userKey, timeout);
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(String userKey, Runnable action) {
        withLock(userKey, () -> {
            action.run();
            return null;
        });
    }

    public int size() {
        return locks.size();
    }

    boolean isLocked(String userKey) {
        ReentrantLock lock = locks.get(userKey);
        return lock != null && lock.isLocked();
    }
}
