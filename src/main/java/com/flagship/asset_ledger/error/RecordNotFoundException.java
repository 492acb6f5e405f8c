package com.flagship.asset_ledger.error;

import java.util.UUID;

/**
 * Raised when an operation names a record that does not exist.
 */
public class RecordNotFoundException extends LedgerException {

    private final UUID recordId;

    private RecordNotFoundException(ErrorCode code, String kind, UUID recordId) {
        super(code, kind + " not found: " + recordId);
        this.recordId = recordId;
    }

    public static RecordNotFoundException asset(UUID assetId) {
        return new RecordNotFoundException(ErrorCode.ASSET_NOT_FOUND, "Asset", assetId);
    }

    public static RecordNotFoundException order(UUID orderId) {
        return new RecordNotFoundException(ErrorCode.ORDER_NOT_FOUND, "Trade order", orderId);
    }

    public static RecordNotFoundException settlementAccount(UUID accountId) {
        return new RecordNotFoundException(ErrorCode.SETTLEMENT_ACCOUNT_NOT_FOUND, "Settlement account", accountId);
    }

    public UUID getRecordId() {
        return recordId;
    }
}
