package com.flagship.shipping_workflow.payment;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

/**
 * HTTP entry points for payments: the provider's status webhook and balance
 * top-up requests.
 *
 * The webhook always answers 200 with the outcome so the provider stops
 * retrying; a duplicate or unknown reference is not an error for it.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class PaymentWebhookController {

    private final PaymentCompletionCoordinator coordinator;
    private final PaymentRecordService paymentRecordService;

    @PostMapping("/api/webhooks/payments")
    public ResponseEntity<WebhookResponse> onPaymentEvent(@RequestBody PaymentEvent event) {
        PaymentOutcome outcome = coordinator.apply(event);
        log.info("Webhook processed: externalReference={}, status={}, outcome={}",
                event.getExternalReference(), event.getStatus(), outcome);
        return ResponseEntity.ok(new WebhookResponse(event.getExternalReference(), outcome));
    }

    @PostMapping("/api/users/{userKey}/top-ups")
    public ResponseEntity<TopUpResponse> openTopUp(@PathVariable String userKey,
                                                   @Valid @RequestBody TopUpRequest request) {
        PaymentRecord record = paymentRecordService.openTopUp(userKey, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new TopUpResponse(record.getExternalReference(), record.getPaymentUrl(),
                        record.getRequestedAmount(), record.getStatus()));
    }

    @Value
    public static class WebhookResponse {
        @JsonProperty("external_reference")
        String externalReference;
        @JsonProperty("outcome")
        PaymentOutcome outcome;
    }

    @Value
    public static class TopUpRequest {
        @NotNull(message = "Amount is required")
        @DecimalMin(value = "0.01", message = "Amount must be positive")
        BigDecimal amount;
    }

    @Value
    public static class TopUpResponse {
        @JsonProperty("external_reference")
        String externalReference;
        @JsonProperty("payment_url")
        String paymentUrl;
        @JsonProperty("amount")
        BigDecimal amount;
        @JsonProperty("status")
        PaymentStatus status;
    }
}
