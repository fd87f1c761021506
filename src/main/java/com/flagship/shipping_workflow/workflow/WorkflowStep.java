package com.flagship.shipping_workflow.workflow;

/**
 * Nodes of the shipment-ordering workflow.
 *
 * The order of declaration follows the forward path. COMPLETED and CANCELLED
 * are terminal: a session never rests on them, they only label the outcome
 * returned to the caller.
 */
public enum WorkflowStep {
    START("Send any message to start a new shipment."),
    FROM_NAME("Sender full name:"),
    FROM_ADDRESS("Sender street address:"),
    FROM_ADDRESS2("Sender address line 2 (apartment, suite), or skip:"),
    FROM_CITY("Sender city:"),
    FROM_STATE("Sender state (2-letter code, e.g. CA):"),
    FROM_ZIP("Sender ZIP code:"),
    FROM_PHONE("Sender phone number, or skip:"),
    TO_NAME("Recipient full name:"),
    TO_ADDRESS("Recipient street address:"),
    TO_ADDRESS2("Recipient address line 2 (apartment, suite), or skip:"),
    TO_CITY("Recipient city:"),
    TO_STATE("Recipient state (2-letter code, e.g. NY):"),
    TO_ZIP("Recipient ZIP code:"),
    TO_PHONE("Recipient phone number, or skip:"),
    PARCEL_WEIGHT("Parcel weight in pounds:"),
    PARCEL_LENGTH("Parcel length in inches, or skip to use 10x10x10:"),
    PARCEL_WIDTH("Parcel width in inches, or skip:"),
    PARCEL_HEIGHT("Parcel height in inches, or skip:"),
    CONFIRM_DATA("Check the shipment details and reply 'confirm':"),
    CARRIER_SELECTION("Choose a rate by number or id, or refresh the list:"),
    PAYMENT_METHOD("Pay with 'balance' or 'invoice':"),
    COMPLETED("Order placed."),
    CANCELLED("Order cancelled.");

    private final String prompt;

    WorkflowStep(String prompt) {
        this.prompt = prompt;
    }

    public String getPrompt() {
        return prompt;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
