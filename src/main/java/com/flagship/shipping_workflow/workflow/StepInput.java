package com.flagship.shipping_workflow.workflow;

import com.flagship.shipping_workflow.quote.Quote;
import com.flagship.shipping_workflow.session.Session;
import lombok.Value;

import java.util.List;

/**
 * What a step contract sees: the raw user input, the session it applies to
 * and, at carrier selection, the quotes currently on offer.
 */
@Value
public class StepInput {
    String raw;
    Session session;
    List<Quote> quotes;

    public static StepInput of(String raw, Session session) {
        return new StepInput(raw, session, List.of());
    }
}
