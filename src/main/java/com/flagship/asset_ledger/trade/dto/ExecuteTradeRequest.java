package com.flagship.asset_ledger.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_ledger.trade.ExecuteTradeCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

@Value
@Builder
@Jacksonized
public class ExecuteTradeRequest {

    @NotNull(message = "Order ID is required")
    @JsonProperty("order_id")
    UUID orderId;

    @NotNull(message = "Asset ID is required")
    @JsonProperty("asset_id")
    UUID assetId;

    @NotBlank(message = "Order owner is required")
    @JsonProperty("order_owner")
    String orderOwner;

    @NotBlank(message = "Buyer is required")
    @JsonProperty("buyer")
    String buyer;

    @NotNull(message = "Settlement source is required")
    @JsonProperty("settlement_source")
    UUID settlementSource;

    @NotNull(message = "Settlement destination is required")
    @JsonProperty("settlement_destination")
    UUID settlementDestination;

    public ExecuteTradeCommand toCommand() {
        return ExecuteTradeCommand.builder()
            .orderId(orderId)
            .assetId(assetId)
            .orderOwner(orderOwner)
            .buyer(buyer)
            .settlementSource(settlementSource)
            .settlementDestination(settlementDestination)
            .build();
    }
}
