package com.flagship.asset_ledger.asset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_ledger.asset.Asset;
import com.flagship.asset_ledger.asset.AssetType;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Response DTO for asset operations. Timestamps are epoch seconds.
 */
@Value
@Builder
public class AssetResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("owner_id")
    String ownerId;

    @JsonProperty("asset_type")
    AssetType assetType;

    @JsonProperty("weight")
    long weight;

    @JsonProperty("purity")
    int purity;

    @JsonProperty("certification")
    String certification;

    @JsonProperty("current_price")
    long currentPrice;

    @JsonProperty("created_at")
    long createdAt;

    @JsonProperty("last_price_update")
    long lastPriceUpdate;

    @JsonProperty("is_active")
    boolean active;

    public static AssetResponse from(Asset asset) {
        return AssetResponse.builder()
            .id(asset.getId())
            .ownerId(asset.getOwnerId())
            .assetType(asset.getAssetType())
            .weight(asset.getWeight())
            .purity(asset.getPurity())
            .certification(asset.getCertification())
            .currentPrice(asset.getCurrentPrice())
            .createdAt(asset.getCreatedAt())
            .lastPriceUpdate(asset.getLastPriceUpdate())
            .active(asset.isActive())
            .build();
    }
}
