package com.flagship.shipping_workflow.workflow;

import com.flagship.shipping_workflow.account.InsufficientBalanceException;
import com.flagship.shipping_workflow.config.WorkflowProperties;
import com.flagship.shipping_workflow.lock.LockTimeoutException;
import com.flagship.shipping_workflow.lock.UserLockRegistry;
import com.flagship.shipping_workflow.observability.WorkflowMetrics;
import com.flagship.shipping_workflow.order.Order;
import com.flagship.shipping_workflow.order.OrderPaymentStatus;
import com.flagship.shipping_workflow.order.OrderPlacement;
import com.flagship.shipping_workflow.order.OrderService;
import com.flagship.shipping_workflow.order.PaymentMethod;
import com.flagship.shipping_workflow.payment.PaymentProviderException;
import com.flagship.shipping_workflow.quote.InMemoryQuoteCache;
import com.flagship.shipping_workflow.quote.Quote;
import com.flagship.shipping_workflow.quote.QuoteFingerprint;
import com.flagship.shipping_workflow.quote.QuoteService;
import com.flagship.shipping_workflow.quote.RateFetchException;
import com.flagship.shipping_workflow.quote.RateProvider;
import com.flagship.shipping_workflow.session.CompletionRecord;
import com.flagship.shipping_workflow.session.FieldPatch;
import com.flagship.shipping_workflow.session.InMemorySessionStore;
import com.flagship.shipping_workflow.session.Session;
import com.flagship.shipping_workflow.session.SessionField;
import com.flagship.shipping_workflow.shipment.ShipmentDetails;
import com.flagship.shipping_workflow.support.MutableClock;
import com.flagship.shipping_workflow.template.AddressTemplate;
import com.flagship.shipping_workflow.template.TemplateRejectedException;
import com.flagship.shipping_workflow.template.TemplateService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkflowControllerTest {

    private static final String USER = "tg:1001";

    @Mock
    private RateProvider rateProvider;

    @Mock
    private OrderService orderService;

    @Mock
    private TemplateService templateService;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private InMemorySessionStore sessionStore;
    private InMemoryQuoteCache quoteCache;
    private UserLockRegistry locks;
    private WorkflowController controller;

    private final List<Quote> quotes = List.of(
            new Quote("q-2", "UPS", "Ground", new BigDecimal("9.80"), 4),
            new Quote("q-1", "USPS", "Ground Advantage", new BigDecimal("7.25"), 5));

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        WorkflowMetrics metrics = new WorkflowMetrics(meterRegistry);
        WorkflowProperties properties = new WorkflowProperties();

        sessionStore = new InMemorySessionStore(clock, Duration.ofMinutes(15));
        locks = new UserLockRegistry(Duration.ofMillis(200), metrics);
        quoteCache = new InMemoryQuoteCache(clock);
        QuoteService quoteService = new QuoteService(quoteCache, rateProvider, metrics, properties);

        controller = new WorkflowController(sessionStore, locks,
                StepGraph.standard(BigDecimal.TEN, () -> "+12025550199"),
                quoteService, orderService, templateService, metrics, clock, properties);
    }

    @Test
    @DisplayName("start creates a session and moves it to the first question")
    void start_movesToFromName() {
        PromptDescriptor prompt = controller.start(USER);

        assertEquals(WorkflowStep.FROM_NAME, prompt.getStep());
        assertNull(prompt.getError());
        assertFalse(prompt.isSkippable());
        assertFalse(prompt.isRestartRequired());
        assertNotNull(prompt.getOrderCorrelationId());
        assertEquals(WorkflowStep.FROM_NAME, sessionStore.get(USER).orElseThrow().getCurrentStep());
    }

    @Test
    @DisplayName("start on an active session resumes it without resetting data")
    void start_resumesActiveSession() {
        controller.start(USER);
        controller.advance(USER, "John Smith");

        PromptDescriptor prompt = controller.start(USER);

        assertEquals(WorkflowStep.FROM_ADDRESS, prompt.getStep());
        assertEquals("John Smith", sessionStore.get(USER).orElseThrow().getFields().get(SessionField.FROM_NAME));
    }

    @Test
    @DisplayName("Input sent to a session created directly at START answers the first question")
    void advance_fromStartAppliesToFirstQuestion() {
        sessionStore.getOrCreate(USER, FieldPatch.empty());

        PromptDescriptor prompt = controller.advance(USER, "John");

        assertEquals(WorkflowStep.FROM_ADDRESS, prompt.getStep());
        assertNull(prompt.getError());
        assertEquals("John", sessionStore.get(USER).orElseThrow().getFields().get(SessionField.FROM_NAME));
        assertEquals(1.0, meterRegistry.counter("workflow.transitions",
                "from", "START", "to", "FROM_NAME", "kind", "forward").count());
    }

    @Test
    @DisplayName("Forward path with skips reaches confirmation with all fields for review")
    void forwardPath_reachesConfirmation() {
        PromptDescriptor prompt = driveToConfirmation(USER);

        assertEquals(WorkflowStep.CONFIRM_DATA, prompt.getStep());
        assertEquals("John Smith", prompt.getFields().get("from_name"));
        assertTrue(prompt.getFields().containsKey("from_address2"));
        assertNull(prompt.getFields().get("from_address2"));
        assertEquals("+12025550199", prompt.getFields().get("to_phone"));
        assertEquals("10", prompt.getFields().get("length"));
        assertEquals("10", prompt.getFields().get("height"));
        assertEquals(1.0, meterRegistry.counter("workflow.transitions",
                "from", "PARCEL_LENGTH", "to", "CONFIRM_DATA", "kind", "skip").count());
    }

    @Test
    @DisplayName("Invalid input returns an error and leaves the session untouched")
    void invalidInput_leavesSessionUnchanged() {
        controller.start(USER);
        Session before = sessionStore.get(USER).orElseThrow();
        clock.advance(Duration.ofMinutes(1));

        PromptDescriptor prompt = controller.advance(USER, "J");

        assertEquals(WorkflowStep.FROM_NAME, prompt.getStep());
        assertNotNull(prompt.getError());
        assertEquals(before, sessionStore.get(USER).orElseThrow());
        assertEquals(1.0, meterRegistry.counter("workflow.input.rejected", "step", "FROM_NAME").count());
    }

    @Test
    @DisplayName("Skipping a required step is refused")
    void skip_requiredStepRefused() {
        controller.start(USER);

        PromptDescriptor prompt = controller.skip(USER);

        assertEquals(WorkflowStep.FROM_NAME, prompt.getStep());
        assertEquals("This step can't be skipped", prompt.getError());
    }

    @Test
    @DisplayName("Confirming fetches quotes once; later lookups hit the cache")
    void confirm_fetchesQuotesThenUsesCache() {
        when(rateProvider.fetchQuotes(any())).thenReturn(quotes);
        driveToConfirmation(USER);

        PromptDescriptor carrier = controller.advance(USER, "confirm");
        assertEquals(WorkflowStep.CARRIER_SELECTION, carrier.getStep());
        assertEquals("q-1", carrier.getQuotes().get(0).getQuoteId());

        PromptDescriptor described = controller.describe(USER).orElseThrow();
        assertEquals(2, described.getQuotes().size());

        PromptDescriptor payment = controller.advance(USER, "1");
        assertEquals(WorkflowStep.PAYMENT_METHOD, payment.getStep());

        Session session = sessionStore.get(USER).orElseThrow();
        assertEquals("q-1", session.getFields().get(SessionField.SELECTED_QUOTE_ID));
        assertEquals("7.25", session.getFields().get(SessionField.SELECTED_AMOUNT));
        verify(rateProvider, times(1)).fetchQuotes(any());
    }

    @Test
    @DisplayName("A failed rate lookup rolls back to confirmation with the error recorded")
    void rateFailure_rollsBackToConfirmation() {
        when(rateProvider.fetchQuotes(any())).thenThrow(new RateFetchException("carrier API down"));
        driveToConfirmation(USER);

        PromptDescriptor prompt = controller.advance(USER, "confirm");

        assertEquals(WorkflowStep.CONFIRM_DATA, prompt.getStep());
        assertTrue(prompt.getError().contains("carrier API down"));
        Session session = sessionStore.get(USER).orElseThrow();
        assertEquals(WorkflowStep.CONFIRM_DATA, session.getCurrentStep());
        assertEquals("CARRIER_SELECTION", session.getFields().get(SessionField.ERROR_STEP));
        assertEquals("John Smith", session.getFields().get(SessionField.FROM_NAME));
    }

    @Test
    @DisplayName("Refreshing quotes is only possible at carrier selection and refetches")
    void refreshQuotes() {
        controller.start(USER);
        assertNotNull(controller.refreshQuotes(USER).getError());

        when(rateProvider.fetchQuotes(any())).thenReturn(quotes);
        driveToCarrierSelection(USER);

        PromptDescriptor refreshed = controller.refreshQuotes(USER);

        assertEquals(WorkflowStep.CARRIER_SELECTION, refreshed.getStep());
        assertNull(refreshed.getError());
        assertEquals(2, refreshed.getQuotes().size());
        verify(rateProvider, times(2)).fetchQuotes(any());
    }

    @Test
    @DisplayName("A choice by position after the offered rates expired is refused and the new list shown")
    void expiredRates_positionalChoiceRefused() {
        List<Quote> changed = List.of(
                new Quote("q-9", "FedEx", "Home", new BigDecimal("6.10"), 3),
                new Quote("q-1", "USPS", "Ground Advantage", new BigDecimal("7.25"), 5));
        when(rateProvider.fetchQuotes(any())).thenReturn(quotes, changed);
        driveToCarrierSelection(USER);
        dropCachedQuotes();

        PromptDescriptor refused = controller.advance(USER, "1");

        assertEquals(WorkflowStep.CARRIER_SELECTION, refused.getStep());
        assertEquals(WorkflowController.RATES_CHANGED, refused.getError());
        assertEquals("q-9", refused.getQuotes().get(0).getQuoteId());
        assertFalse(sessionStore.get(USER).orElseThrow().has(SessionField.SELECTED_QUOTE_ID));

        PromptDescriptor payment = controller.advance(USER, "1");

        assertEquals(WorkflowStep.PAYMENT_METHOD, payment.getStep());
        assertEquals("q-9", sessionStore.get(USER).orElseThrow().getFields().get(SessionField.SELECTED_QUOTE_ID));
        verify(rateProvider, times(2)).fetchQuotes(any());
    }

    @Test
    @DisplayName("A choice by quote id still holds after the offered rates expired")
    void expiredRates_choiceByIdAccepted() {
        when(rateProvider.fetchQuotes(any())).thenReturn(quotes);
        driveToCarrierSelection(USER);
        dropCachedQuotes();

        PromptDescriptor payment = controller.advance(USER, "q-2");

        assertEquals(WorkflowStep.PAYMENT_METHOD, payment.getStep());
        assertNull(payment.getError());
        assertEquals("UPS", sessionStore.get(USER).orElseThrow().getFields().get(SessionField.SELECTED_CARRIER));
    }

    @Test
    @DisplayName("Templates can't be saved before the shipment is confirmed")
    void saveTemplate_beforeConfirmationRefused() {
        controller.start(USER);

        PromptDescriptor prompt = controller.saveTemplate(USER, "Home");

        assertEquals(WorkflowStep.FROM_NAME, prompt.getStep());
        assertNotNull(prompt.getError());
        assertNull(prompt.getNotice());
        verifyNoInteractions(templateService);
    }

    @Test
    @DisplayName("Saving a template at confirmation keeps the user where they are")
    void saveTemplate_atConfirmation() {
        driveToConfirmation(USER);
        when(templateService.save(eq(USER), eq("Home"), any())).thenAnswer(invocation ->
                new AddressTemplate(UUID.randomUUID(), USER, "Home",
                        invocation.<Session>getArgument(2).getFields(), clock.instant()));

        PromptDescriptor prompt = controller.saveTemplate(USER, "Home");

        assertEquals(WorkflowStep.CONFIRM_DATA, prompt.getStep());
        assertEquals("Template 'Home' saved", prompt.getNotice());
        assertNull(prompt.getError());
        assertEquals("John Smith", prompt.getFields().get("from_name"));

        ArgumentCaptor<Session> saved = ArgumentCaptor.forClass(Session.class);
        verify(templateService).save(eq(USER), eq("Home"), saved.capture());
        assertEquals("10012", saved.getValue().getFields().get(SessionField.TO_ZIP));
    }

    @Test
    @DisplayName("A refused template comes back as an error on the current prompt")
    void saveTemplate_rejected() {
        driveToConfirmation(USER);
        when(templateService.save(eq(USER), eq("Home"), any()))
                .thenThrow(new TemplateRejectedException("Maximum template limit reached (10)"));

        PromptDescriptor prompt = controller.saveTemplate(USER, "Home");

        assertEquals(WorkflowStep.CONFIRM_DATA, prompt.getStep());
        assertEquals("Maximum template limit reached (10)", prompt.getError());
        assertEquals(WorkflowStep.CONFIRM_DATA, sessionStore.get(USER).orElseThrow().getCurrentStep());
    }

    @Test
    @DisplayName("Starting from a template replaces the session and asks for the parcel weight")
    void startFromTemplate_landsOnParcelWeight() {
        String oldCorrelationId = controller.start(USER).getOrderCorrelationId();
        controller.advance(USER, "Someone Else");
        AddressTemplate template = template();
        when(templateService.find(USER, template.getId())).thenReturn(Optional.of(template));

        PromptDescriptor prompt = controller.startFromTemplate(USER, template.getId());

        assertEquals(WorkflowStep.PARCEL_WEIGHT, prompt.getStep());
        assertEquals("Using template 'Office'", prompt.getNotice());
        assertNotEquals(oldCorrelationId, prompt.getOrderCorrelationId());
        Session session = sessionStore.get(USER).orElseThrow();
        assertEquals("Ada Lovelace", session.getFields().get(SessionField.FROM_NAME));
        assertTrue(session.has(SessionField.FROM_ADDRESS2));
        assertEquals(1.0, meterRegistry.counter("workflow.transitions",
                "from", "START", "to", "PARCEL_WEIGHT", "kind", "template").count());

        controller.advance(USER, "3");
        PromptDescriptor review = controller.skip(USER);

        assertEquals(WorkflowStep.CONFIRM_DATA, review.getStep());
        assertEquals("Ada Lovelace", review.getFields().get("from_name"));
        assertEquals("10001", review.getFields().get("to_zip"));
        assertEquals("3", review.getFields().get("weight"));
    }

    @Test
    @DisplayName("An unknown template is a bad request and leaves the session alone")
    void startFromTemplate_unknown() {
        controller.start(USER);
        UUID missing = UUID.randomUUID();
        when(templateService.find(USER, missing)).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> controller.startFromTemplate(USER, missing));
        assertEquals(WorkflowStep.FROM_NAME, sessionStore.get(USER).orElseThrow().getCurrentStep());
    }

    @Test
    @DisplayName("Paying by balance places the order, archives the session and frees the user")
    void completeWithBalance_archivesSession() {
        when(rateProvider.fetchQuotes(any())).thenReturn(quotes);
        Order order = paidOrder();
        when(orderService.placeOrder(any(), any(), eq(PaymentMethod.BALANCE)))
                .thenReturn(new OrderPlacement(order, null));
        String correlationId = driveToCarrierSelection(USER).getOrderCorrelationId();
        controller.advance(USER, "q-1");

        PromptDescriptor done = controller.advance(USER, "balance");

        assertEquals(WorkflowStep.COMPLETED, done.getStep());
        assertEquals(correlationId, done.getOrderCorrelationId());
        assertNull(done.getPaymentUrl());
        assertTrue(sessionStore.get(USER).isEmpty());

        List<CompletionRecord> archive = sessionStore.getArchive();
        assertEquals(1, archive.size());
        assertEquals(order.getId(), archive.get(0).getOrderId());
        assertEquals("BALANCE", archive.get(0).getFields().get("payment_method"));

        ArgumentCaptor<Session> placed = ArgumentCaptor.forClass(Session.class);
        verify(orderService).placeOrder(placed.capture(), any(), eq(PaymentMethod.BALANCE));
        assertEquals("q-1", placed.getValue().getFields().get(SessionField.SELECTED_QUOTE_ID));
    }

    @Test
    @DisplayName("Insufficient balance keeps the user at the payment step")
    void insufficientBalance_staysAtPaymentMethod() {
        when(rateProvider.fetchQuotes(any())).thenReturn(quotes);
        when(orderService.placeOrder(any(), any(), eq(PaymentMethod.BALANCE)))
                .thenThrow(new InsufficientBalanceException(USER, new BigDecimal("5.00"), new BigDecimal("7.25")));
        driveToCarrierSelection(USER);
        controller.advance(USER, "1");

        PromptDescriptor prompt = controller.advance(USER, "balance");

        assertEquals(WorkflowStep.PAYMENT_METHOD, prompt.getStep());
        assertTrue(prompt.getError().contains("5.00 available"));
        assertTrue(prompt.getError().contains("7.25 required"));
        assertEquals(WorkflowStep.PAYMENT_METHOD, sessionStore.get(USER).orElseThrow().getCurrentStep());
        assertTrue(sessionStore.getArchive().isEmpty());
    }

    @Test
    @DisplayName("Invoice provider failure keeps the user at the payment step")
    void invoiceProviderFailure_staysAtPaymentMethod() {
        when(rateProvider.fetchQuotes(any())).thenReturn(quotes);
        when(orderService.placeOrder(any(), any(), eq(PaymentMethod.INVOICE)))
                .thenThrow(new PaymentProviderException("timeout"));
        driveToCarrierSelection(USER);
        controller.advance(USER, "1");

        PromptDescriptor prompt = controller.advance(USER, "invoice");

        assertEquals(WorkflowStep.PAYMENT_METHOD, prompt.getStep());
        assertTrue(prompt.getError().startsWith("Payment service unavailable"));
    }

    @Test
    @DisplayName("Rollback moves to the predecessor and keeps collected fields")
    void rollback_keepsFields() {
        controller.start(USER);
        controller.advance(USER, "John Smith");
        controller.advance(USER, "12 Main St");
        controller.skip(USER);

        PromptDescriptor back = controller.rollback(USER, "Going back at the user's request");

        assertEquals(WorkflowStep.FROM_ADDRESS2, back.getStep());
        assertEquals("Going back at the user's request", back.getError());
        Session session = sessionStore.get(USER).orElseThrow();
        assertEquals("12 Main St", session.getFields().get(SessionField.FROM_ADDRESS));

        PromptDescriptor next = controller.advance(USER, "Apt 4");
        assertNull(next.getError());
        assertNull(sessionStore.get(USER).orElseThrow().getFields().get(SessionField.LAST_ERROR));
    }

    @Test
    @DisplayName("An expired session is replaced by a fresh one and the caller is told to restart")
    void expiredSession_restarts() {
        String oldCorrelationId = controller.start(USER).getOrderCorrelationId();
        controller.advance(USER, "John Smith");
        clock.advance(Duration.ofMinutes(15));

        PromptDescriptor prompt = controller.advance(USER, "12 Main St");

        assertTrue(prompt.isRestartRequired());
        assertEquals(WorkflowStep.FROM_NAME, prompt.getStep());
        assertNotEquals(oldCorrelationId, prompt.getOrderCorrelationId());
        assertFalse(sessionStore.get(USER).orElseThrow().has(SessionField.FROM_NAME));
        assertEquals(WorkflowStep.FROM_NAME, sessionStore.get(USER).orElseThrow().getCurrentStep());
        assertEquals(1.0, meterRegistry.counter("workflow.sessions.expired").count());

        PromptDescriptor next = controller.advance(USER, "John");

        assertEquals(WorkflowStep.FROM_ADDRESS, next.getStep());
        assertFalse(next.isRestartRequired());
        assertEquals("John", sessionStore.get(USER).orElseThrow().getFields().get(SessionField.FROM_NAME));
    }

    @Test
    @DisplayName("Cancel drops the session and succeeds when there is none")
    void cancel() {
        controller.start(USER);

        PromptDescriptor cancelled = controller.cancel(USER);

        assertEquals(WorkflowStep.CANCELLED, cancelled.getStep());
        assertTrue(sessionStore.get(USER).isEmpty());
        assertEquals(WorkflowStep.CANCELLED, controller.cancel(USER).getStep());
        assertTrue(controller.describe(USER).isEmpty());
    }

    @Test
    @DisplayName("describe never creates a session")
    void describe_isReadOnly() {
        assertTrue(controller.describe(USER).isEmpty());
        assertTrue(sessionStore.get(USER).isEmpty());
    }

    @Test
    @DisplayName("A blank user key is rejected")
    void blankUserKey_rejected() {
        assertThrows(IllegalArgumentException.class, () -> controller.start(" "));
    }

    @Test
    @DisplayName("A busy user lock times out while other users proceed")
    void busyLock_timesOutForSameUserOnly() throws Exception {
        controller.start(USER);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> locks.runWithLock(USER, () -> {
                held.countDown();
                awaitQuietly(release);
            }));
            assertTrue(held.await(5, TimeUnit.SECONDS));

            assertThrows(LockTimeoutException.class, () -> controller.advance(USER, "John Smith"));
            assertEquals(WorkflowStep.FROM_NAME, controller.start("tg:2002").getStep());

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        assertEquals(WorkflowStep.FROM_ADDRESS, controller.advance(USER, "John Smith").getStep());
        assertEquals(1.0, meterRegistry.counter("workflow.lock.timeouts").count());
    }

    private PromptDescriptor driveToConfirmation(String userKey) {
        controller.start(userKey);
        controller.advance(userKey, "John Smith");
        controller.advance(userKey, "12 Main St");
        controller.skip(userKey);
        controller.advance(userKey, "Austin");
        controller.advance(userKey, "tx");
        controller.advance(userKey, "78701");
        controller.skip(userKey);
        controller.advance(userKey, "Jane Doe");
        controller.advance(userKey, "500 Broadway");
        controller.skip(userKey);
        controller.advance(userKey, "New York");
        controller.advance(userKey, "NY");
        controller.advance(userKey, "10012");
        controller.skip(userKey);
        controller.advance(userKey, "2.5");
        return controller.skip(userKey);
    }

    private PromptDescriptor driveToCarrierSelection(String userKey) {
        driveToConfirmation(userKey);
        return controller.advance(userKey, "confirm");
    }

    private void dropCachedQuotes() {
        Session session = sessionStore.get(USER).orElseThrow();
        quoteCache.delete(QuoteFingerprint.of(ShipmentDetails.fromSession(session, BigDecimal.TEN)));
    }

    private AddressTemplate template() {
        Map<SessionField, String> fields = new EnumMap<>(SessionField.class);
        fields.put(SessionField.FROM_NAME, "Ada Lovelace");
        fields.put(SessionField.FROM_ADDRESS, "100 Congress Ave");
        fields.put(SessionField.FROM_ADDRESS2, null);
        fields.put(SessionField.FROM_CITY, "Austin");
        fields.put(SessionField.FROM_STATE, "TX");
        fields.put(SessionField.FROM_ZIP, "78701");
        fields.put(SessionField.FROM_PHONE, "+15125551234");
        fields.put(SessionField.TO_NAME, "Grace Hopper");
        fields.put(SessionField.TO_ADDRESS, "1 Liberty Plaza");
        fields.put(SessionField.TO_ADDRESS2, null);
        fields.put(SessionField.TO_CITY, "New York");
        fields.put(SessionField.TO_STATE, "NY");
        fields.put(SessionField.TO_ZIP, "10001");
        fields.put(SessionField.TO_PHONE, "+12125550100");
        return new AddressTemplate(UUID.randomUUID(), USER, "Office", fields, clock.instant());
    }

    private Order paidOrder() {
        return Order.builder()
                .id(UUID.randomUUID())
                .userKey(USER)
                .paymentMethod(PaymentMethod.BALANCE)
                .paymentStatus(OrderPaymentStatus.PAID)
                .amount(new BigDecimal("7.25"))
                .build();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
