package com.flagship.shipping_workflow.session;

/**
 * Thrown when a mutation targets a session that no longer exists or has
 * outlived its TTL.
 */
public class SessionExpiredException extends RuntimeException {

    private final String userKey;

    public SessionExpiredException(String userKey) {
        super("No live session for user " + userKey);
        this.userKey = userKey;
    }

    public String getUserKey() {
        return userKey;
    }
}
