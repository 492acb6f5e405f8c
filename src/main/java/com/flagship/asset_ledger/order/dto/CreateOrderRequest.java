package com.flagship.asset_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_ledger.order.OrderType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class CreateOrderRequest {

    @NotNull(message = "Asset ID is required")
    @JsonProperty("asset_id")
    UUID assetId;

    @NotBlank(message = "Owner is required")
    @JsonProperty("owner_id")
    String ownerId;

    @NotNull(message = "Order type is required")
    @JsonProperty("order_type")
    OrderType orderType;

    @JsonProperty("quantity")
    long quantity;

    @JsonProperty("price_per_unit")
    long pricePerUnit;
}
