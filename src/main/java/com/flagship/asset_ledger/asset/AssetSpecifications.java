package com.flagship.asset_ledger.asset;

import org.springframework.data.jpa.domain.Specification;

/**
 * Optional filters for asset listings. A null argument means "any".
 */
public final class AssetSpecifications {

    private AssetSpecifications() {
    }

    public static Specification<AssetEntity> ownedBy(String ownerId) {
        return (r, q, cb) -> (ownerId == null || ownerId.isBlank())
                ? null
                : cb.equal(r.get("ownerId"), ownerId);
    }

    public static Specification<AssetEntity> ofType(AssetType assetType) {
        return (r, q, cb) -> assetType == null ? null : cb.equal(r.get("assetType"), assetType);
    }

    public static Specification<AssetEntity> active(Boolean active) {
        return (r, q, cb) -> active == null ? null : cb.equal(r.get("active"), active);
    }

    public static Specification<AssetEntity> all(String ownerId, AssetType assetType, Boolean active) {
        return Specification.allOf(
                ownedBy(ownerId),
                ofType(assetType),
                active(active)
        );
    }
}
