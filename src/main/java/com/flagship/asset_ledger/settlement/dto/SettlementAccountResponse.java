package com.flagship.asset_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_ledger.settlement.SettlementAccount;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementAccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("owner_id")
    String ownerId;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("created_at")
    Instant createdAt;

    public static SettlementAccountResponse from(SettlementAccount account, long balance) {
        return SettlementAccountResponse.builder()
            .id(account.getId())
            .ownerId(account.getOwnerId())
            .balance(balance)
            .createdAt(account.getCreatedAt())
            .build();
    }
}
