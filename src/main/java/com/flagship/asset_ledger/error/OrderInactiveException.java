package com.flagship.asset_ledger.error;

import java.util.UUID;

public class OrderInactiveException extends LedgerException {

    private final UUID orderId;

    public OrderInactiveException(UUID orderId) {
        super(ErrorCode.ORDER_INACTIVE, "Order " + orderId + " is inactive");
        this.orderId = orderId;
    }

    public UUID getOrderId() {
        return orderId;
    }
}
