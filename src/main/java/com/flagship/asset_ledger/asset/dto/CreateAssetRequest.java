package com.flagship.asset_ledger.asset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_ledger.asset.AssetType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request DTO for registering an asset.
 *
 * Weight, purity and certification are recorded as given.
 */
@Value
@Builder
@Jacksonized
public class CreateAssetRequest {

    @NotBlank(message = "Owner is required")
    @JsonProperty("owner_id")
    String ownerId;

    @NotNull(message = "Asset type is required")
    @JsonProperty("asset_type")
    AssetType assetType;

    @JsonProperty("weight")
    long weight;

    @JsonProperty("purity")
    int purity;

    @JsonProperty("certification")
    String certification;

    @JsonProperty("initial_price")
    long initialPrice;
}
