package com.flagship.asset_ledger.asset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class UpdatePriceRequest {

    @NotNull(message = "New price is required")
    @JsonProperty("new_price")
    Long newPrice;
}
