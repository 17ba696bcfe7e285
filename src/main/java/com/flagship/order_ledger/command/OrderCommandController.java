package com.flagship.order_ledger.command;

import com.flagship.order_ledger.command.dto.CancelOrderRequest;
import com.flagship.order_ledger.command.dto.CommandResponse;
import com.flagship.order_ledger.command.dto.CreateOrderRequest;
import com.flagship.order_ledger.command.dto.OrderItemRequest;
import com.flagship.order_ledger.observability.OrderMetrics;
import com.flagship.order_ledger.order.CurrencyCode;
import com.flagship.order_ledger.order.OrderLine;
import com.flagship.order_ledger.order.exception.OrderValidationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * REST endpoints for order commands.
 *
 * Every endpoint answers with the stream version the command left behind.
 * Reads go through the query endpoints and may lag behind that version.
 *
 * Create accepts an optional Idempotency-Key header. A repeated key returns
 * the first result with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Slf4j
public class OrderCommandController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    // OrderCreated is always the first event of a stream
    private static final long CREATED_VERSION = 1L;

    private final OrderCommandHandler commandHandler;
    private final CommandIdempotencyService idempotencyService;
    private final OrderMetrics metrics;

    @PostMapping
    public ResponseEntity<CommandResponse> createOrder(
            @Valid @RequestBody CreateOrderRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        CurrencyCode currency = parseCurrency(request.getCurrency());
        List<OrderLine> lines = request.getItems().stream()
            .map(OrderItemRequest::toOrderLine)
            .toList();

        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            CommandResult result = commandHandler.handle(
                CreateOrderCommand.of(request.getCustomerId(), currency, lines));
            return ResponseEntity.status(HttpStatus.CREATED).body(CommandResponse.from(result));
        }

        var previous = idempotencyService.find(idempotencyKey, CommandType.CREATE_ORDER);
        if (previous.isPresent()) {
            metrics.recordIdempotencyHit();
            log.info("Idempotency key already used, returning order {}", previous.get().getAggregateId());
            return ResponseEntity.ok(CommandResponse.from(previous.get().toResult()));
        }
        metrics.recordIdempotencyMiss();

        CommandResult result = commandHandler.handle(
            CreateOrderCommand.withIdempotencyKey(idempotencyKey, request.getCustomerId(), currency, lines));
        if (result.isNoOp()) {
            // Another request with the same key created the order first
            CommandReceipt recorded = idempotencyService.remember(idempotencyKey, CommandType.CREATE_ORDER,
                CommandResult.noOp(result.getAggregateId(), CREATED_VERSION));
            return ResponseEntity.ok(CommandResponse.from(recorded.toResult()));
        }
        idempotencyService.remember(idempotencyKey, CommandType.CREATE_ORDER, result);
        return ResponseEntity.status(HttpStatus.CREATED).body(CommandResponse.from(result));
    }

    @PostMapping("/{id}/items")
    public ResponseEntity<CommandResponse> addItem(@PathVariable("id") UUID id,
                                                   @Valid @RequestBody OrderItemRequest request) {
        CommandResult result = commandHandler.handle(AddItemCommand.of(id, request.toOrderLine()));
        return ResponseEntity.ok(CommandResponse.from(result));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<CommandResponse> confirmOrder(@PathVariable("id") UUID id) {
        CommandResult result = commandHandler.handle(ConfirmOrderCommand.of(id));
        return ResponseEntity.ok(CommandResponse.from(result));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<CommandResponse> cancelOrder(@PathVariable("id") UUID id,
                                                       @Valid @RequestBody(required = false) CancelOrderRequest request) {
        String reason = request == null ? null : request.getReason();
        CommandResult result = commandHandler.handle(CancelOrderCommand.of(id, reason));
        return ResponseEntity.ok(CommandResponse.from(result));
    }

    private static CurrencyCode parseCurrency(String currency) {
        try {
            return CurrencyCode.valueOf(currency.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new OrderValidationException("Invalid currency code: " + currency);
        }
    }
}
