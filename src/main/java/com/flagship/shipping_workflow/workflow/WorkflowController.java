package com.flagship.shipping_workflow.workflow;

import com.flagship.shipping_workflow.account.InsufficientBalanceException;
import com.flagship.shipping_workflow.config.WorkflowProperties;
import com.flagship.shipping_workflow.lock.UserLockRegistry;
import com.flagship.shipping_workflow.observability.CorrelationContext;
import com.flagship.shipping_workflow.observability.WorkflowMetrics;
import com.flagship.shipping_workflow.order.OrderPlacement;
import com.flagship.shipping_workflow.order.OrderService;
import com.flagship.shipping_workflow.order.PaymentMethod;
import com.flagship.shipping_workflow.payment.PaymentProviderException;
import com.flagship.shipping_workflow.quote.Quote;
import com.flagship.shipping_workflow.quote.QuoteService;
import com.flagship.shipping_workflow.quote.RateFetchException;
import com.flagship.shipping_workflow.session.CompletionRecord;
import com.flagship.shipping_workflow.session.FieldPatch;
import com.flagship.shipping_workflow.session.Session;
import com.flagship.shipping_workflow.session.SessionExpiredException;
import com.flagship.shipping_workflow.session.SessionField;
import com.flagship.shipping_workflow.session.SessionStore;
import com.flagship.shipping_workflow.shipment.ShipmentDetails;
import com.flagship.shipping_workflow.template.AddressTemplate;
import com.flagship.shipping_workflow.template.TemplateRejectedException;
import com.flagship.shipping_workflow.template.TemplateService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives a user's session through the {@link StepGraph}.
 *
 * Every mutating operation runs under the user's lock, so two messages from
 * the same user are applied one after the other while different users never
 * wait on each other. Invalid input leaves the session untouched and comes
 * back as a prompt with an error.
 *
 * A session that expired, vanished or sits on a terminal step is replaced by
 * a fresh one at the first question and the prompt is flagged
 * {@code restartRequired}. START is never a resting point reached through
 * this class.
 */
@Service
@Slf4j
public class WorkflowController {

    static final String RATES_CHANGED = "Rates were refreshed since the list was shown, choose again from this list";

    private final SessionStore sessionStore;
    private final UserLockRegistry locks;
    private final StepGraph graph;
    private final QuoteService quoteService;
    private final OrderService orderService;
    private final TemplateService templateService;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final BigDecimal defaultDimension;

    public WorkflowController(SessionStore sessionStore,
                              UserLockRegistry locks,
                              StepGraph graph,
                              QuoteService quoteService,
                              OrderService orderService,
                              TemplateService templateService,
                              WorkflowMetrics metrics,
                              Clock clock,
                              WorkflowProperties properties) {
        this.sessionStore = sessionStore;
        this.locks = locks;
        this.graph = graph;
        this.quoteService = quoteService;
        this.orderService = orderService;
        this.templateService = templateService;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultDimension = properties.getParcel().getDefaultDimension();
    }

    /**
     * Starts a workflow, or resumes the one in progress.
     */
    public PromptDescriptor start(String userKey) {
        return locked("start", userKey, () -> {
            Session session = sessionStore.getOrCreate(userKey, FieldPatch.empty());
            if (session.getCurrentStep() == WorkflowStep.START) {
                return prompt(leaveStart(session), null, null);
            }
            log.info("Resuming session: step={}", session.getCurrentStep());
            return resume(session);
        });
    }

    /**
     * Feeds one user message to the current step.
     *
     * @throws com.flagship.shipping_workflow.lock.LockTimeoutException if the user's lock stays busy
     */
    public PromptDescriptor advance(String userKey, String rawInput) {
        return locked("advance", userKey, () -> {
            Session session = liveSession(userKey);
            if (session.getCurrentStep() == WorkflowStep.START) {
                session = leaveStart(session);
            }
            WorkflowStep step = session.getCurrentStep();

            StepInput input;
            if (step == WorkflowStep.CARRIER_SELECTION) {
                Optional<List<Quote>> shown = quoteService.cachedQuotesFor(shipmentOf(session));
                List<Quote> quotes;
                try {
                    quotes = shown.isPresent() ? shown.get() : quoteService.quotesFor(shipmentOf(session));
                } catch (RateFetchException e) {
                    return rollbackAfterRateFailure(session, e);
                }
                if (shown.isEmpty() && !offersQuoteId(quotes, rawInput)) {
                    // a position in the old list may name a different rate now
                    metrics.recordInputRejected(step.name());
                    log.info("Offered rates expired before the choice, showing the refetched list");
                    return prompt(session, RATES_CHANGED, quotes);
                }
                input = new StepInput(rawInput, session, quotes);
            } else {
                input = StepInput.of(rawInput, session);
            }

            StepResult result = graph.evaluate(step, input);
            if (!result.isAccepted()) {
                metrics.recordInputRejected(step.name());
                log.debug("Input rejected: step={}, error={}", step, result.getError());
                return prompt(session, result.getError(), input.getQuotes());
            }
            if (result.getNextStep() == WorkflowStep.COMPLETED) {
                return complete(session, result.getPatch());
            }
            return applyTransition(session, result, "forward");
        });
    }

    /**
     * Takes the current step's skip edge.
     */
    public PromptDescriptor skip(String userKey) {
        return locked("skip", userKey, () -> {
            Session session = liveSession(userKey);
            Optional<StepResult> skipped = graph.skip(session.getCurrentStep());
            if (skipped.isEmpty()) {
                metrics.recordInputRejected(session.getCurrentStep().name());
                return prompt(session, "This step can't be skipped", null);
            }
            return applyTransition(session, skipped.get(), "skip");
        });
    }

    /**
     * Drops the session. Succeeds whether or not one exists.
     */
    public PromptDescriptor cancel(String userKey) {
        return locked("cancel", userKey, () -> {
            Optional<Session> session = sessionStore.get(userKey);
            sessionStore.clear(userKey);
            String from = session.map(s -> s.getCurrentStep().name()).orElse(null);
            metrics.recordTransition(from, WorkflowStep.CANCELLED.name(), "cancel");
            log.info("Session cancelled: step={}", from);
            return PromptDescriptor.builder()
                    .step(WorkflowStep.CANCELLED)
                    .message(WorkflowStep.CANCELLED.getPrompt())
                    .orderCorrelationId(session.map(Session::getOrderCorrelationId).orElse(null))
                    .build();
        });
    }

    /**
     * Moves the session back to the current step's predecessor. Collected
     * fields are kept; {@code reason} is recorded on the session and shown to
     * the user.
     */
    public PromptDescriptor rollback(String userKey, String reason) {
        return locked("rollback", userKey, () -> {
            Session rolledBack = rollbackInternal(liveSession(userKey), reason);
            return resume(rolledBack);
        });
    }

    /**
     * Discards the cached quotes for the session's shipment and fetches new ones.
     */
    public PromptDescriptor refreshQuotes(String userKey) {
        return locked("refresh_quotes", userKey, () -> {
            Session session = liveSession(userKey);
            if (session.getCurrentStep() != WorkflowStep.CARRIER_SELECTION) {
                return prompt(session, "Rates can only be refreshed while choosing a carrier", null);
            }
            List<Quote> quotes;
            try {
                quotes = quoteService.refresh(shipmentOf(session));
            } catch (RateFetchException e) {
                return rollbackAfterRateFailure(session, e);
            }
            Session touched = sessionStore.updateAtomic(userKey, null, FieldPatch.empty())
                    .orElseThrow(() -> new SessionExpiredException(userKey));
            return prompt(touched, null, quotes);
        });
    }

    /**
     * Saves the session's addresses as a named template. Only possible once
     * the collected data reached confirmation.
     */
    public PromptDescriptor saveTemplate(String userKey, String name) {
        return locked("save_template", userKey, () -> {
            Session session = liveSession(userKey);
            if (session.getCurrentStep().ordinal() < WorkflowStep.CONFIRM_DATA.ordinal()) {
                return resume(session).toBuilder()
                        .error("Addresses can be saved as a template once the shipment is confirmed")
                        .build();
            }
            AddressTemplate template;
            try {
                template = templateService.save(userKey, name, session);
            } catch (TemplateRejectedException e) {
                log.info("Template not saved: {}", e.getMessage());
                return resume(session).toBuilder().error(e.getMessage()).build();
            }
            Session touched = sessionStore.updateAtomic(userKey, null, FieldPatch.empty())
                    .orElseThrow(() -> new SessionExpiredException(userKey));
            return resume(touched).toBuilder()
                    .notice("Template '" + template.getName() + "' saved")
                    .build();
        });
    }

    /**
     * Replaces any session in progress with a new one prefilled from the
     * template, resting on the parcel weight question.
     *
     * @throws IllegalArgumentException if the user has no such template
     */
    public PromptDescriptor startFromTemplate(String userKey, UUID templateId) {
        return locked("start_template", userKey, () -> {
            AddressTemplate template = templateService.find(userKey, templateId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown template: " + templateId));

            sessionStore.get(userKey).ifPresent(previous ->
                    log.info("Replacing session at {} with template {}", previous.getCurrentStep(), templateId));
            sessionStore.clear(userKey);
            sessionStore.getOrCreate(userKey, template.toPatch());
            Session prefilled = sessionStore.updateAtomic(userKey, WorkflowStep.PARCEL_WEIGHT, FieldPatch.empty())
                    .orElseThrow(() -> new SessionExpiredException(userKey));

            metrics.recordTransition(WorkflowStep.START.name(), WorkflowStep.PARCEL_WEIGHT.name(), "template");
            log.info("Started from template: id={}, orderCorrelationId={}",
                    templateId, prefilled.getOrderCorrelationId());
            return prompt(prefilled, null, null).toBuilder()
                    .notice("Using template '" + template.getName() + "'")
                    .build();
        });
    }

    /**
     * Current prompt for the user, without changing anything.
     */
    public Optional<PromptDescriptor> describe(String userKey) {
        return sessionStore.get(userKey).map(this::resume);
    }

    private PromptDescriptor applyTransition(Session session, StepResult result, String kind) {
        String userKey = session.getUserKey();
        WorkflowStep from = session.getCurrentStep();
        WorkflowStep to = result.getNextStep();

        FieldPatch patch = result.getPatch();
        if (session.field(SessionField.LAST_ERROR).isPresent()) {
            patch = patch.with(SessionField.LAST_ERROR, null).with(SessionField.ERROR_STEP, null);
        }

        Session updated = sessionStore.updateAtomic(userKey, to, patch)
                .orElseThrow(() -> new SessionExpiredException(userKey));
        metrics.recordTransition(from.name(), to.name(), kind);
        log.info("Step transition: {} -> {} ({})", from, to, kind);

        if (to == WorkflowStep.CARRIER_SELECTION) {
            return enterCarrierSelection(updated);
        }
        return prompt(updated, null, null);
    }

    /**
     * Takes the START edge. Whatever the user typed at START is meant for
     * the step it leads to.
     */
    private Session leaveStart(Session session) {
        StepResult entered = graph.evaluate(WorkflowStep.START, StepInput.of(null, session));
        Session moved = sessionStore.updateAtomic(session.getUserKey(), entered.getNextStep(), entered.getPatch())
                .orElseThrow(() -> new SessionExpiredException(session.getUserKey()));
        metrics.recordTransition(WorkflowStep.START.name(), moved.getCurrentStep().name(), "forward");
        log.info("Step transition: {} -> {} (forward)", WorkflowStep.START, moved.getCurrentStep());
        return moved;
    }

    private static boolean offersQuoteId(List<Quote> quotes, String rawInput) {
        String choice = rawInput == null ? "" : rawInput.strip();
        return quotes.stream().anyMatch(q -> q.getQuoteId().equals(choice));
    }

    private PromptDescriptor enterCarrierSelection(Session session) {
        try {
            List<Quote> quotes = quoteService.quotesFor(shipmentOf(session));
            return prompt(session, null, quotes);
        } catch (RateFetchException e) {
            return rollbackAfterRateFailure(session, e);
        }
    }

    private PromptDescriptor rollbackAfterRateFailure(Session session, RateFetchException e) {
        log.warn("Rate lookup failed, rolling back: step={}, error={}", session.getCurrentStep(), e.getMessage());
        Session rolledBack = rollbackInternal(session, "Could not get rates: " + e.getMessage());
        return resume(rolledBack);
    }

    private Session rollbackInternal(Session session, String reason) {
        WorkflowStep from = session.getCurrentStep();
        WorkflowStep target = graph.predecessorOf(from);
        FieldPatch annotation = FieldPatch.of(SessionField.LAST_ERROR, reason)
                .with(SessionField.ERROR_STEP, from.name());

        Session rolledBack = sessionStore.updateAtomic(session.getUserKey(), target, annotation)
                .orElseThrow(() -> new SessionExpiredException(session.getUserKey()));
        metrics.recordTransition(from.name(), target.name(), "rollback");
        log.info("Rolled back: {} -> {}, reason={}", from, target, reason);
        return rolledBack;
    }

    /**
     * Places the order and hands the session off to the archive. Payment
     * problems keep the user at the payment step.
     */
    private PromptDescriptor complete(Session session, FieldPatch paymentPatch) {
        PaymentMethod method = PaymentMethod.valueOf(paymentPatch.get(SessionField.PAYMENT_METHOD));
        Session finished = session.apply(null, paymentPatch, clock.instant());

        OrderPlacement placement;
        try {
            placement = orderService.placeOrder(finished, shipmentOf(finished), method);
        } catch (InsufficientBalanceException e) {
            metrics.recordInputRejected(session.getCurrentStep().name());
            log.info("Balance payment refused: available={}, required={}", e.getAvailable(), e.getRequired());
            return prompt(session, String.format(
                    "Insufficient balance: %s available, %s required. Top up or pay by 'invoice'",
                    e.getAvailable().toPlainString(), e.getRequired().toPlainString()), null);
        } catch (PaymentProviderException e) {
            log.warn("Invoice could not be opened: {}", e.getMessage());
            return prompt(session, "Payment service unavailable, try again or pay with 'balance'", null);
        }

        sessionStore.finalizeAndArchive(session.getUserKey(),
                CompletionRecord.of(finished, placement.getOrder().getId(), clock.instant()));
        metrics.recordTransition(session.getCurrentStep().name(), WorkflowStep.COMPLETED.name(), "forward");
        log.info("Session completed: orderCorrelationId={}, method={}",
                session.getOrderCorrelationId(), method);

        return PromptDescriptor.builder()
                .step(WorkflowStep.COMPLETED)
                .message(WorkflowStep.COMPLETED.getPrompt())
                .orderCorrelationId(session.getOrderCorrelationId())
                .paymentUrl(placement.paymentUrl().orElse(null))
                .build();
    }

    /**
     * Live session on a non-terminal step.
     *
     * @throws SessionExpiredException otherwise
     */
    private Session liveSession(String userKey) {
        Session session = sessionStore.get(userKey)
                .orElseThrow(() -> new SessionExpiredException(userKey));
        if (session.getCurrentStep().isTerminal()) {
            throw new SessionExpiredException(userKey);
        }
        return session;
    }

    private PromptDescriptor restart(String userKey) {
        metrics.recordSessionExpired();
        sessionStore.clear(userKey);
        Session fresh = leaveStart(sessionStore.getOrCreate(userKey, FieldPatch.empty()));
        log.info("No live session, restarted: orderCorrelationId={}", fresh.getOrderCorrelationId());
        return prompt(fresh, null, null).toBuilder()
                .restartRequired(true)
                .build();
    }

    /**
     * Prompt for a session at rest, including the quotes still cached at
     * carrier selection.
     */
    private PromptDescriptor resume(Session session) {
        List<Quote> quotes = null;
        if (session.getCurrentStep() == WorkflowStep.CARRIER_SELECTION) {
            quotes = quoteService.cachedQuotesFor(shipmentOf(session)).orElse(null);
        }
        return prompt(session, null, quotes);
    }

    private PromptDescriptor prompt(Session session, String error, List<Quote> quotes) {
        WorkflowStep step = session.getCurrentStep();
        return PromptDescriptor.builder()
                .step(step)
                .message(step.getPrompt())
                .error(error != null ? error : session.field(SessionField.LAST_ERROR).orElse(null))
                .skippable(graph.isDefined(step) && graph.definition(step).isSkippable())
                .quotes(quotes == null || quotes.isEmpty() ? null : quotes)
                .fields(step == WorkflowStep.CONFIRM_DATA ? review(session) : null)
                .orderCorrelationId(session.getOrderCorrelationId())
                .build();
    }

    private static Map<String, String> review(Session session) {
        Map<String, String> fields = new LinkedHashMap<>();
        session.getFields().forEach((field, value) -> {
            if (field != SessionField.LAST_ERROR && field != SessionField.ERROR_STEP) {
                fields.put(field.getKey(), value);
            }
        });
        return fields;
    }

    private ShipmentDetails shipmentOf(Session session) {
        return ShipmentDetails.fromSession(session, defaultDimension);
    }

    private PromptDescriptor locked(String operation, String userKey, Supplier<PromptDescriptor> action) {
        if (userKey == null || userKey.isBlank()) {
            throw new IllegalArgumentException("User key is required");
        }
        long start = System.nanoTime();
        try (MDC.MDCCloseable ignored = CorrelationContext.user(userKey)) {
            return locks.withLock(userKey, () -> {
                try {
                    return action.get();
                } catch (SessionExpiredException e) {
                    return restart(userKey);
                }
            });
        } finally {
            metrics.recordOperationLatency(operation, (System.nanoTime() - start) / 1_000_000);
        }
    }
}
