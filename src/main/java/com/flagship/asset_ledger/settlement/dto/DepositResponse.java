package com.flagship.asset_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class DepositResponse {

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("balance")
    long balance;
}
