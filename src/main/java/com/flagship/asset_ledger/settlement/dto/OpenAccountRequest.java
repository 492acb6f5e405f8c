package com.flagship.asset_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class OpenAccountRequest {

    @NotBlank(message = "Owner is required")
    @JsonProperty("owner_id")
    String ownerId;
}
