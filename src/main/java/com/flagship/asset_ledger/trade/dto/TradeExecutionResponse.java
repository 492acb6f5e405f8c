package com.flagship.asset_ledger.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_ledger.trade.TradeExecution;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class TradeExecutionResponse {

    @JsonProperty("order_id")
    UUID orderId;

    @JsonProperty("asset_id")
    UUID assetId;

    @JsonProperty("seller")
    String seller;

    @JsonProperty("buyer")
    String buyer;

    @JsonProperty("settled_amount")
    long settledAmount;

    @JsonProperty("settlement_transfer_id")
    UUID settlementTransferId;

    @JsonProperty("executed_at")
    long executedAt;

    public static TradeExecutionResponse from(TradeExecution execution) {
        return TradeExecutionResponse.builder()
            .orderId(execution.getOrderId())
            .assetId(execution.getAssetId())
            .seller(execution.getSeller())
            .buyer(execution.getBuyer())
            .settledAmount(execution.getSettledAmount())
            .settlementTransferId(execution.getSettlementTransferId())
            .executedAt(execution.getExecutedAt())
            .build();
    }
}
