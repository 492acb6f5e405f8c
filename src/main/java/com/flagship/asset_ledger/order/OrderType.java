package com.flagship.asset_ledger.order;

/**
 * Side of an order. Recorded only; execution treats both sides alike.
 */
public enum OrderType {
    BUY,
    SELL
}
