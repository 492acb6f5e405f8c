package com.flagship.asset_ledger.asset;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * JPA entity for the asset record.
 *
 * - No setters: the only mutations are {@link #applyPrice} and {@link #transferTo}
 * - Identity fields (id, type, weight, purity, certification, created_at) are not updatable
 * - Created only through {@link #fromDomain}
 */
@Entity
@Table(
    name = "assets",
    indexes = {
        @Index(name = "idx_assets_owner_id", columnList = "owner_id"),
        @Index(name = "idx_assets_asset_type", columnList = "asset_type")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AssetEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "asset_type", nullable = false, updatable = false, length = 16)
    private AssetType assetType;

    @Column(nullable = false, updatable = false)
    private long weight;

    @Column(nullable = false, updatable = false)
    private int purity;

    @Column(updatable = false)
    private String certification;

    @Column(name = "current_price", nullable = false)
    private long currentPrice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private long createdAt;

    @Column(name = "last_price_update", nullable = false)
    private long lastPriceUpdate;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    static AssetEntity fromDomain(Asset asset) {
        return new AssetEntity(
            asset.getId(),
            asset.getOwnerId(),
            asset.getAssetType(),
            asset.getWeight(),
            asset.getPurity(),
            asset.getCertification(),
            asset.getCurrentPrice(),
            asset.getCreatedAt(),
            asset.getLastPriceUpdate(),
            asset.isActive()
        );
    }

    public Asset toDomain() {
        return new Asset(
            id,
            ownerId,
            assetType,
            weight,
            purity,
            certification,
            currentPrice,
            createdAt,
            lastPriceUpdate,
            active
        );
    }

    void applyPrice(Asset repriced) {
        this.currentPrice = repriced.getCurrentPrice();
        this.lastPriceUpdate = repriced.getLastPriceUpdate();
    }

    void transferTo(Asset transferred) {
        this.ownerId = transferred.getOwnerId();
    }
}
