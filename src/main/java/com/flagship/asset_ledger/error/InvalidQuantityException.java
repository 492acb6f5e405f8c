package com.flagship.asset_ledger.error;

import java.util.UUID;

public class InvalidQuantityException extends LedgerException {

    private final UUID orderId;
    private final long quantity;

    public InvalidQuantityException(UUID orderId, long quantity) {
        super(ErrorCode.INVALID_QUANTITY,
            String.format("Order %s has invalid quantity %d; quantity must be positive", orderId, quantity));
        this.orderId = orderId;
        this.quantity = quantity;
    }

    public UUID getOrderId() {
        return orderId;
    }

    public long getQuantity() {
        return quantity;
    }
}
