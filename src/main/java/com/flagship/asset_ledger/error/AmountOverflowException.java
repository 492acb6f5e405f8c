package com.flagship.asset_ledger.error;

import java.util.UUID;

public class AmountOverflowException extends LedgerException {

    private final UUID orderId;

    public AmountOverflowException(UUID orderId, long quantity, long pricePerUnit) {
        super(ErrorCode.AMOUNT_OVERFLOW,
            String.format("Order %s settlement amount %d x %d exceeds the representable range",
                orderId, quantity, pricePerUnit));
        this.orderId = orderId;
    }

    public UUID getOrderId() {
        return orderId;
    }
}
