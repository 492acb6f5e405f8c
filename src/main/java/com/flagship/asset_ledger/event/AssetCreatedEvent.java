package com.flagship.asset_ledger.event;

import com.flagship.asset_ledger.asset.Asset;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an asset is registered.
 */
@Value
public class AssetCreatedEvent implements LedgerEvent {
    UUID eventId;
    UUID assetId;
    String ownerId;
    String assetType;
    long weight;
    int purity;
    long initialPrice;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return assetId;
    }

    public static AssetCreatedEvent fromAsset(Asset asset) {
        return new AssetCreatedEvent(
            UUID.randomUUID(),
            asset.getId(),
            asset.getOwnerId(),
            asset.getAssetType().name(),
            asset.getWeight(),
            asset.getPurity(),
            asset.getCurrentPrice(),
            Instant.ofEpochSecond(asset.getCreatedAt())
        );
    }
}
