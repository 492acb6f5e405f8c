package com.flagship.asset_ledger.error;

import java.util.UUID;

public class DuplicateAssetException extends LedgerException {

    private final UUID assetId;

    public DuplicateAssetException(UUID assetId, String ownerId, String assetType) {
        super(ErrorCode.DUPLICATE_ASSET,
            String.format("Asset %s already exists for owner '%s' and type %s", assetId, ownerId, assetType));
        this.assetId = assetId;
    }

    public UUID getAssetId() {
        return assetId;
    }
}
