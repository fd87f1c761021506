package com.flagship.shipping_workflow.lock;

import java.time.Duration;

/**
 * Thrown when the per-user lock could not be acquired in time. The caller
 * should ask the user to retry.
 */
public class LockTimeoutException extends RuntimeException {

    private final String userKey;

    public LockTimeoutException(String userKey, Duration waited) {
        super("Timed out after " + waited.toMillis() + "ms waiting for lock of user " + userKey);
        this.userKey = userKey;
    }

    public LockTimeoutException(String userKey, InterruptedException cause) {
        super("Interrupted while waiting for lock of user " + userKey, cause);
        this.userKey = userKey;
    }

    public String getUserKey() {
        return userKey;
    }
}
