package com.flagship.asset_ledger.asset;

import com.flagship.asset_ledger.asset.dto.AssetResponse;
import com.flagship.asset_ledger.asset.dto.CreateAssetRequest;
import com.flagship.asset_ledger.asset.dto.UpdatePriceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST Controller for the asset registry.
 *
 * Ownership transfer is not exposed here; it only happens as part of a trade.
 */
@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
@Slf4j
public class AssetController {

    static final String CALLER_ID_HEADER = "X-Caller-Id";

    private final AssetRegistryService registryService;

    @PostMapping
    public ResponseEntity<AssetResponse> createAsset(@Valid @RequestBody CreateAssetRequest request) {
        log.info("Received asset registration: owner={}, type={}", request.getOwnerId(), request.getAssetType());

        Asset asset = registryService.createAsset(
            request.getOwnerId(),
            request.getAssetType(),
            request.getWeight(),
            request.getPurity(),
            request.getCertification(),
            request.getInitialPrice()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(AssetResponse.from(asset));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AssetResponse> getAsset(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AssetResponse.from(registryService.getAsset(id)));
    }

    @GetMapping
    public ResponseEntity<List<AssetResponse>> listAssets(
            @RequestParam(name = "owner_id", required = false) String ownerId,
            @RequestParam(name = "asset_type", required = false) AssetType assetType,
            @RequestParam(name = "active", required = false) Boolean active) {

        List<AssetResponse> assets = registryService.listAssets(ownerId, assetType, active).stream()
            .map(AssetResponse::from)
            .toList();
        return ResponseEntity.ok(assets);
    }

    /**
     * Updates the current price. The caller identity comes from the
     * {@code X-Caller-Id} header and must match the asset owner.
     */
    @PutMapping("/{id}/price")
    public ResponseEntity<AssetResponse> updatePrice(
            @PathVariable("id") UUID id,
            @RequestHeader(CALLER_ID_HEADER) String callerId,
            @Valid @RequestBody UpdatePriceRequest request) {

        Asset repriced = registryService.updatePrice(id, callerId, request.getNewPrice());
        return ResponseEntity.ok(AssetResponse.from(repriced));
    }
}
