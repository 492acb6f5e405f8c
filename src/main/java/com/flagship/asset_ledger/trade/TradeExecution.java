package com.flagship.asset_ledger.trade;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a settled trade. {@code seller} is the asset owner before the trade.
 */
@Value
public class TradeExecution {
    UUID orderId;
    UUID assetId;
    String seller;
    String buyer;
    long settledAmount;
    UUID settlementTransferId;
    long executedAt;
}
