package com.flagship.shipping_workflow.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.shipping_workflow.quote.Quote;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What the transport should show the user after an operation: the step the
 * session now rests on and everything needed to render its prompt.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PromptDescriptor {

    @JsonProperty("step")
    WorkflowStep step;

    @JsonProperty("message")
    String message;

    /** Why the last input was refused or why the session was rolled back. */
    @JsonProperty("error")
    String error;

    /** Outcome of a side action such as saving a template. */
    @JsonProperty("notice")
    String notice;

    @JsonProperty("skippable")
    boolean skippable;

    /** Quotes on offer, only at carrier selection. */
    @JsonProperty("quotes")
    List<Quote> quotes;

    /** Collected data for review, only at confirmation. */
    @JsonProperty("fields")
    Map<String, String> fields;

    @JsonProperty("order_correlation_id")
    String orderCorrelationId;

    /** Invoice link after an order paid by invoice. */
    @JsonProperty("payment_url")
    String paymentUrl;

    /** The previous session was gone (expired or finished) and a new one was started. */
    @JsonProperty("restart_required")
    boolean restartRequired;
}
