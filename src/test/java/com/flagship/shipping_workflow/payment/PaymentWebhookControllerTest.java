package com.flagship.shipping_workflow.payment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PaymentWebhookController.class)
class PaymentWebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PaymentCompletionCoordinator coordinator;

    @MockBean
    private PaymentRecordService paymentRecordService;

    @Test
    @DisplayName("Webhook events are handed to the coordinator and the outcome is echoed")
    void webhook_applies() throws Exception {
        when(coordinator.apply(any(PaymentEvent.class))).thenReturn(PaymentOutcome.APPLIED);

        mockMvc.perform(post("/api/webhooks/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "external_reference": "inv-1",
                                  "status": "paid",
                                  "amount": 50.00,
                                  "kind": "BALANCE_TOPUP",
                                  "provider_extra": "ignored"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.external_reference").value("inv-1"))
                .andExpect(jsonPath("$.outcome").value("APPLIED"));

        ArgumentCaptor<PaymentEvent> event = ArgumentCaptor.forClass(PaymentEvent.class);
        verify(coordinator).apply(event.capture());
        assertEquals("inv-1", event.getValue().getExternalReference());
        assertEquals(0, new BigDecimal("50.00").compareTo(event.getValue().getAmount()));
        assertEquals(PaymentKind.BALANCE_TOPUP, event.getValue().getKind());
    }

    @Test
    @DisplayName("Provider kind spellings are accepted and unknown kinds still answer 200")
    void webhook_providerKinds() throws Exception {
        when(coordinator.apply(any(PaymentEvent.class))).thenReturn(PaymentOutcome.APPLIED);

        mockMvc.perform(post("/api/webhooks/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"external_reference\": \"abc123\", \"status\": \"paid\", "
                                + "\"amount\": 50.00, \"kind\": \"balance-topup\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("APPLIED"));
        mockMvc.perform(post("/api/webhooks/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"external_reference\": \"abc124\", \"status\": \"paid\", "
                                + "\"kind\": \"gift-card\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<PaymentEvent> events = ArgumentCaptor.forClass(PaymentEvent.class);
        verify(coordinator, times(2)).apply(events.capture());
        assertEquals(PaymentKind.BALANCE_TOPUP, events.getAllValues().get(0).getKind());
        assertNull(events.getAllValues().get(1).getKind());
    }

    @Test
    @DisplayName("Duplicates and unknown references still answer 200")
    void webhook_duplicateIs200() throws Exception {
        when(coordinator.apply(any(PaymentEvent.class))).thenReturn(PaymentOutcome.REJECTED);

        mockMvc.perform(post("/api/webhooks/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"external_reference\": \"nope\", \"status\": \"paid\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("REJECTED"));
    }

    @Test
    @DisplayName("Top-up requests open an invoice and return its link")
    void topUp_created() throws Exception {
        Instant now = Instant.parse("2026-03-02T10:00:00Z");
        when(paymentRecordService.openTopUp("tg:1", new BigDecimal("25.00"))).thenReturn(PaymentRecord.builder()
                .id(UUID.randomUUID())
                .externalReference("inv-7")
                .userKey("tg:1")
                .kind(PaymentKind.BALANCE_TOPUP)
                .requestedAmount(new BigDecimal("25.00"))
                .status(PaymentStatus.PENDING)
                .paymentUrl("https://pay.example.com/inv-7")
                .createdAt(now)
                .updatedAt(now)
                .build());

        mockMvc.perform(post("/api/users/tg:1/top-ups")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": \"25.00\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.external_reference").value("inv-7"))
                .andExpect(jsonPath("$.payment_url").value("https://pay.example.com/inv-7"))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("Non-positive top-up amounts are a 400")
    void topUp_invalidAmount() throws Exception {
        mockMvc.perform(post("/api/users/tg:1/top-ups")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.amount").value("Amount must be positive"));

        verifyNoInteractions(paymentRecordService);
    }

    @Test
    @DisplayName("A provider outage while opening a top-up is a 502 carrying the correlation id")
    void topUp_providerDown() throws Exception {
        when(paymentRecordService.openTopUp("tg:1", new BigDecimal("25.00")))
                .thenThrow(new PaymentProviderException("timeout"));

        mockMvc.perform(post("/api/users/tg:1/top-ups")
                        .header("X-Correlation-ID", "corr-502")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": \"25.00\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Payment Provider Unavailable"))
                .andExpect(jsonPath("$.correlation_id").value("corr-502"));
    }
}
