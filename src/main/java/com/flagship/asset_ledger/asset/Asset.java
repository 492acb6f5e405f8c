package com.flagship.asset_ledger.asset;

import lombok.Value;

import java.util.UUID;

/**
 * One physical unit of a precious material or gem under custody.
 *
 * Immutable: every change produces a new instance. Weight is in the smallest
 * unit (milligram-equivalent), prices in the smallest settlement denomination,
 * timestamps in epoch seconds. {@code lastPriceUpdate} stays 0 until the first
 * price update.
 *
 * Weight, purity and certification are recorded as given; no range checks
 * are applied to them.
 */
@Value
public class Asset {
    UUID id;
    String ownerId;
    AssetType assetType;
    long weight;
    int purity;
    String certification;
    long currentPrice;
    long createdAt;
    long lastPriceUpdate;
    boolean active;

    /**
     * Creates a new active asset priced at {@code initialPrice}.
     */
    public static Asset create(UUID id, String ownerId, AssetType assetType, long weight, int purity,
                               String certification, long initialPrice, long now) {
        return new Asset(
            id,
            ownerId,
            assetType,
            weight,
            purity,
            certification,
            initialPrice,
            now,
            0L,
            true
        );
    }

    /**
     * Returns this asset repriced at {@code newPrice} as of {@code now}.
     * No floor, ceiling or change limit applies.
     */
    public Asset withPrice(long newPrice, long now) {
        return new Asset(id, ownerId, assetType, weight, purity, certification,
            newPrice, createdAt, now, active);
    }

    /**
     * Returns this asset owned by {@code newOwner}. Unconditional.
     */
    public Asset withOwner(String newOwner) {
        return new Asset(id, newOwner, assetType, weight, purity, certification,
            currentPrice, createdAt, lastPriceUpdate, active);
    }

    public boolean isOwnedBy(String identity) {
        return ownerId.equals(identity);
    }
}
