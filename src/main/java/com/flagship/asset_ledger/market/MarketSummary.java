package com.flagship.asset_ledger.market;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_ledger.asset.AssetType;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time aggregate over active assets and orders.
 *
 * {@code totalValue} is the sum of {@code currentPrice * weight} over active assets.
 */
@Value
@Builder
public class MarketSummary {

    @JsonProperty("total_assets")
    long totalAssets;

    @JsonProperty("total_value")
    BigInteger totalValue;

    @JsonProperty("active_orders")
    long activeOrders;

    @JsonProperty("assets_by_type")
    Map<AssetType, Long> assetsByType;

    @JsonProperty("timestamp")
    Instant timestamp;
}
