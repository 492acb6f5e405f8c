package com.flagship.asset_ledger.event;

import com.flagship.asset_ledger.trade.TradeExecution;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a trade settles.
 *
 * Keyed by the asset id so that ownership changes of one asset stay ordered.
 * Carries the settlement transfer id for consumers that reconcile against the
 * settlement ledger.
 */
@Value
public class TradeExecutedEvent implements LedgerEvent {
    UUID eventId;
    UUID orderId;
    UUID assetId;
    String seller;
    String buyer;
    long settledAmount;
    UUID settlementTransferId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TradeExecuted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return assetId;
    }

    public static TradeExecutedEvent fromExecution(TradeExecution execution) {
        return new TradeExecutedEvent(
            UUID.randomUUID(),
            execution.getOrderId(),
            execution.getAssetId(),
            execution.getSeller(),
            execution.getBuyer(),
            execution.getSettledAmount(),
            execution.getSettlementTransferId(),
            Instant.ofEpochSecond(execution.getExecutedAt())
        );
    }
}
