package com.flagship.asset_ledger.event;

import com.flagship.asset_ledger.order.TradeOrder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class OrderCreatedEvent implements LedgerEvent {
    UUID eventId;
    UUID orderId;
    UUID assetId;
    String ownerId;
    String orderType;
    long quantity;
    long pricePerUnit;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return orderId;
    }

    public static OrderCreatedEvent fromOrder(TradeOrder order) {
        return new OrderCreatedEvent(
            UUID.randomUUID(),
            order.getId(),
            order.getAssetRef(),
            order.getOwnerId(),
            order.getOrderType().name(),
            order.getQuantity(),
            order.getPricePerUnit(),
            Instant.ofEpochSecond(order.getCreatedAt())
        );
    }
}
