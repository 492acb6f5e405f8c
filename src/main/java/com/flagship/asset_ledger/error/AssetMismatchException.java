package com.flagship.asset_ledger.error;

import java.util.UUID;

public class AssetMismatchException extends LedgerException {

    public AssetMismatchException(UUID orderId, UUID orderAssetRef, UUID presentedAssetId) {
        super(ErrorCode.ASSET_MISMATCH,
            String.format("Order %s targets asset %s, not %s", orderId, orderAssetRef, presentedAssetId));
    }
}
