package com.flagship.shipping_workflow.quote;

/**
 * Raised when carrier rates could not be obtained.
 */
public class RateFetchException extends RuntimeException {

    public RateFetchException(String message) {
        super(message);
    }

    public RateFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
