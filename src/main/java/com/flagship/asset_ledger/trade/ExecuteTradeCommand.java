package com.flagship.asset_ledger.trade;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Everything a trade execution names. Authorization evidence travels separately
 * as {@link com.flagship.asset_ledger.auth.TransactionSigners}.
 *
 * Identities are trimmed on the way in, the same way signer identities are.
 */
@Value
@Builder
public class ExecuteTradeCommand {
    UUID orderId;
    UUID assetId;
    String orderOwner;
    String buyer;
    UUID settlementSource;
    UUID settlementDestination;

    void validate() {
        if (orderId == null || assetId == null) {
            throw new IllegalArgumentException("Order and asset are required");
        }
        if (orderOwner == null || orderOwner.isBlank() || buyer == null || buyer.isBlank()) {
            throw new IllegalArgumentException("Order owner and buyer are required");
        }
        if (settlementSource == null || settlementDestination == null) {
            throw new IllegalArgumentException("Settlement source and destination are required");
        }
    }

    public static class ExecuteTradeCommandBuilder {

        public ExecuteTradeCommandBuilder orderOwner(String orderOwner) {
            this.orderOwner = orderOwner != null ? orderOwner.trim() : null;
            return this;
        }

        public ExecuteTradeCommandBuilder buyer(String buyer) {
            this.buyer = buyer != null ? buyer.trim() : null;
            return this;
        }
    }
}
