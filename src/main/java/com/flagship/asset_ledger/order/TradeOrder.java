package com.flagship.asset_ledger.order;

import lombok.Value;

import java.util.UUID;

/**
 * An offer to trade one asset.
 *
 * Immutable. The asset reference is not checked at creation, nor is the
 * relation between the order owner and the asset owner. A consumed order has
 * {@code quantity == 0} and {@code active == false}.
 */
@Value
public class TradeOrder {
    UUID id;
    UUID assetRef;
    String ownerId;
    OrderType orderType;
    long quantity;
    long pricePerUnit;
    long createdAt;
    boolean active;

    public static TradeOrder create(UUID id, UUID assetRef, String ownerId, OrderType orderType,
                                    long quantity, long pricePerUnit, long now) {
        return new TradeOrder(id, assetRef, ownerId, orderType, quantity, pricePerUnit, now, true);
    }

    public OrderState state() {
        return active ? OrderState.ACTIVE : OrderState.CONSUMED;
    }

    /**
     * Returns the consumed form of this order.
     *
     * @throws IllegalStateException if the order is already consumed
     */
    public TradeOrder consume() {
        if (!state().canTransitionTo(OrderState.CONSUMED)) {
            throw new IllegalStateException(
                String.format("Cannot transition order %s from %s to %s", id, state(), OrderState.CONSUMED));
        }
        return new TradeOrder(id, assetRef, ownerId, orderType, 0L, pricePerUnit, createdAt, false);
    }

    public boolean isOwnedBy(String identity) {
        return ownerId.equals(identity);
    }

    public boolean refersTo(UUID assetId) {
        return assetRef.equals(assetId);
    }
}
