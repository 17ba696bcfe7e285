package com.flagship.order_ledger.order;

import com.flagship.order_ledger.order.exception.OrderValidationException;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of an order: a product, how many, and at what unit price.
 */
@Value
public class OrderLine {

    /**
     * Decimal places an amount may carry; order_summaries.total_amount is NUMERIC(19, 4).
     */
    public static final int AMOUNT_SCALE = 4;

    /**
     * Largest amount NUMERIC(19, 4) can hold, for unit prices and order totals alike.
     */
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999999999.9999");

    String productId;
    int quantity;
    BigDecimal unitPrice;

    public static OrderLine of(String productId, int quantity, BigDecimal unitPrice) {
        OrderLine line = new OrderLine(productId, quantity, unitPrice);
        line.validate();
        return line;
    }

    /**
     * unitPrice × quantity
     */
    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    /**
     * @throws OrderValidationException if the line cannot be part of an order
     */
    public void validate() {
        if (productId == null || productId.isBlank()) {
            throw new OrderValidationException("Product ID is required");
        }
        if (quantity <= 0) {
            throw new OrderValidationException(
                String.format("Quantity must be positive for product %s, got %d", productId, quantity));
        }
        if (unitPrice == null) {
            throw new OrderValidationException("Unit price is required for product " + productId);
        }
        if (unitPrice.signum() < 0) {
            throw new OrderValidationException(
                String.format("Unit price must not be negative for product %s, got %s", productId, unitPrice));
        }
        if (unitPrice.stripTrailingZeros().scale() > AMOUNT_SCALE) {
            throw new OrderValidationException(String.format(
                "Unit price of product %s has more than %d decimal places: %s", productId, AMOUNT_SCALE, unitPrice));
        }
        if (lineTotal().compareTo(MAX_AMOUNT) > 0) {
            throw new OrderValidationException(String.format(
                "Line total of product %s exceeds %s", productId, MAX_AMOUNT.toPlainString()));
        }
    }
}
