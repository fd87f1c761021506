package com.flagship.shipping_workflow.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.shipping_workflow.lock.LockTimeoutException;
import com.flagship.shipping_workflow.observability.CorrelationContext;
import com.flagship.shipping_workflow.payment.PaymentProviderException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error bodies for the conversation, balance and payment endpoints. Every
 * body carries the request's correlation id.
 *
 * Workflow validation failures are not errors here: they come back as a
 * normal prompt with {@code error} set.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(LockTimeoutException.class)
    public ResponseEntity<ErrorResponse> userBusy(LockTimeoutException e) {
        log.warn("User {} busy, asking the client to retry", e.getUserKey());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(ErrorResponse.of("Too Many Requests",
                        "Your previous message is still being processed, please retry shortly", null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fieldError.getField(),
                    fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "Invalid value");
        }
        log.warn("Rejected request body: {}", fields);
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Validation Failed", "Request validation failed", fields));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Invalid Request", "Malformed request body", null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badArgument(IllegalArgumentException e) {
        log.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of("Invalid Request", e.getMessage(), null));
    }

    @ExceptionHandler(PaymentProviderException.class)
    public ResponseEntity<ErrorResponse> providerUnavailable(PaymentProviderException e) {
        log.error("Payment provider call failed: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.of("Payment Provider Unavailable",
                        "Could not create an invoice right now, please try again later", null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("Internal Server Error", "An unexpected error occurred", null));
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        @JsonProperty("error")
        String error;
        @JsonProperty("message")
        String message;
        @JsonProperty("details")
        Map<String, String> details;
        @JsonProperty("correlation_id")
        String correlationId;
        @JsonProperty("timestamp")
        Instant timestamp;

        static ErrorResponse of(String error, String message, Map<String, String> details) {
            return new ErrorResponse(error, message, details,
                    CorrelationContext.currentCorrelationId(), Instant.now());
        }
    }
}
