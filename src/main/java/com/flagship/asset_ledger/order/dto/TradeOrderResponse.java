package com.flagship.asset_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_ledger.order.OrderState;
import com.flagship.asset_ledger.order.OrderType;
import com.flagship.asset_ledger.order.TradeOrder;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class TradeOrderResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("asset_id")
    UUID assetId;

    @JsonProperty("owner_id")
    String ownerId;

    @JsonProperty("order_type")
    OrderType orderType;

    @JsonProperty("quantity")
    long quantity;

    @JsonProperty("price_per_unit")
    long pricePerUnit;

    @JsonProperty("created_at")
    long createdAt;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("state")
    OrderState state;

    public static TradeOrderResponse from(TradeOrder order) {
        return TradeOrderResponse.builder()
            .id(order.getId())
            .assetId(order.getAssetRef())
            .ownerId(order.getOwnerId())
            .orderType(order.getOrderType())
            .quantity(order.getQuantity())
            .pricePerUnit(order.getPricePerUnit())
            .createdAt(order.getCreatedAt())
            .active(order.isActive())
            .state(order.state())
            .build();
    }
}
