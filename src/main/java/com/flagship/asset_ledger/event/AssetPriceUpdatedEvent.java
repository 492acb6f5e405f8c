package com.flagship.asset_ledger.event;

import com.flagship.asset_ledger.asset.Asset;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an owner reprices an asset.
 */
@Value
public class AssetPriceUpdatedEvent implements LedgerEvent {
    UUID eventId;
    UUID assetId;
    long previousPrice;
    long newPrice;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetPriceUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return assetId;
    }

    public static AssetPriceUpdatedEvent of(Asset before, Asset after) {
        return new AssetPriceUpdatedEvent(
            UUID.randomUUID(),
            after.getId(),
            before.getCurrentPrice(),
            after.getCurrentPrice(),
            Instant.ofEpochSecond(after.getLastPriceUpdate())
        );
    }
}
