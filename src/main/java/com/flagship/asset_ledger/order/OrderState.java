package com.flagship.asset_ledger.order;

/**
 * Lifecycle of a trade order.
 *
 * Valid transitions:
 * - ACTIVE -> CONSUMED (trade executed)
 *
 * CONSUMED is terminal.
 */
public enum OrderState {
    ACTIVE,
    CONSUMED;

    public boolean canTransitionTo(OrderState target) {
        return this == ACTIVE && target == CONSUMED;
    }
}
