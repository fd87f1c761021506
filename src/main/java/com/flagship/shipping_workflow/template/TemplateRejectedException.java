package com.flagship.shipping_workflow.template;

/**
 * A template could not be saved: bad name, incomplete addresses or the
 * user's limit is reached. The message is meant for the user.
 */
public class TemplateRejectedException extends RuntimeException {

    public TemplateRejectedException(String message) {
        super(message);
    }
}
