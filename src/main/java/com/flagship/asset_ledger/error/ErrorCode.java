package com.flagship.asset_ledger.error;

/**
 * Stable error codes surfaced to callers.
 *
 * Every failed ledger operation reports exactly one of these. The code is
 * part of the API contract; messages are not.
 */
public enum ErrorCode {
    /** Caller is not the record's controlling identity, or did not co-sign. */
    UNAUTHORIZED,
    /** Execution attempted on a consumed order. */
    ORDER_INACTIVE,
    /** Non-positive quantity at execution time. */
    INVALID_QUANTITY,
    /** An asset already occupies the derived address. */
    DUPLICATE_ASSET,
    /** The order targets a different asset than the one presented. */
    ASSET_MISMATCH,
    /** Settlement source cannot cover the transfer amount. */
    INSUFFICIENT_FUNDS,
    /** Quantity times unit price does not fit a settlement amount. */
    AMOUNT_OVERFLOW,
    ASSET_NOT_FOUND,
    ORDER_NOT_FOUND,
    SETTLEMENT_ACCOUNT_NOT_FOUND
}
