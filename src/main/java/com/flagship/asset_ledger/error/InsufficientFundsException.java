package com.flagship.asset_ledger.error;

import java.util.UUID;

public class InsufficientFundsException extends LedgerException {

    private final UUID accountId;
    private final long requested;
    private final long available;

    public InsufficientFundsException(UUID accountId, long requested, long available) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
            String.format("Insufficient settlement balance for account %s: requested=%d, available=%d",
                accountId, requested, available));
        this.accountId = accountId;
        this.requested = requested;
        this.available = available;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public long getRequested() {
        return requested;
    }

    public long getAvailable() {
        return available;
    }
}
