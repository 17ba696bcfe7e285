package com.flagship.order_ledger.order.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps order exceptions to HTTP responses with a consistent body.
 *
 * Rejections (validation, invariants, declines, lost races) are logged at
 * WARN or below. Only a corrupt stream or an unexpected failure is an ERROR.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request could not be read", null);
    }

    @ExceptionHandler(OrderValidationException.class)
    public ResponseEntity<ErrorResponse> handleOrderValidation(OrderValidationException e) {
        log.warn("Invalid order command: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", e.getMessage(), null);
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(OrderNotFoundException e) {
        log.info("Order not found: {}", e.getOrderId());
        return respond(HttpStatus.NOT_FOUND, "Order Not Found", e.getMessage(),
                Map.of("order_id", String.valueOf(e.getOrderId())));
    }

    @ExceptionHandler(PaymentDeclinedException.class)
    public ResponseEntity<ErrorResponse> handlePaymentDeclined(PaymentDeclinedException e) {
        log.warn("Payment declined: orderId={}, reason={}", e.getOrderId(), e.getDeclineReason());
        return respond(HttpStatus.PAYMENT_REQUIRED, "Payment Declined", e.getMessage(),
                Map.of("order_id", String.valueOf(e.getOrderId()),
                       "decline_reason", String.valueOf(e.getDeclineReason())));
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException e) {
        log.warn("Command violates order invariant: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invariant Violation", e.getMessage(),
                Map.of("order_id", String.valueOf(e.getOrderId())));
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<ErrorResponse> handleConcurrencyConflict(ConcurrencyConflictException e) {
        log.warn("Concurrency conflict surfaced to client: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Concurrency Conflict", e.getMessage(),
                Map.of("order_id", String.valueOf(e.getAggregateId()),
                       "expected_version", String.valueOf(e.getExpectedVersion())));
    }

    @ExceptionHandler(CorruptStreamException.class)
    public ResponseEntity<ErrorResponse> handleCorruptStream(CorruptStreamException e) {
        log.error("Corrupt event stream", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Corrupt Event Stream",
                "The order's history cannot be replayed",
                Map.of("order_id", String.valueOf(e.getAggregateId())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
