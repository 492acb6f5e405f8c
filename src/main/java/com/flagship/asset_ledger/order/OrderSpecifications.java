package com.flagship.asset_ledger.order;

import org.springframework.data.jpa.domain.Specification;

import java.util.UUID;

/**
 * Optional filters for order listings. A null argument means "any".
 */
public final class OrderSpecifications {

    private OrderSpecifications() {
    }

    public static Specification<TradeOrderEntity> forAsset(UUID assetId) {
        return (r, q, cb) -> assetId == null ? null : cb.equal(r.get("assetRef"), assetId);
    }

    public static Specification<TradeOrderEntity> ownedBy(String ownerId) {
        return (r, q, cb) -> (ownerId == null || ownerId.isBlank())
                ? null
                : cb.equal(r.get("ownerId"), ownerId);
    }

    public static Specification<TradeOrderEntity> ofType(OrderType orderType) {
        return (r, q, cb) -> orderType == null ? null : cb.equal(r.get("orderType"), orderType);
    }

    public static Specification<TradeOrderEntity> active(Boolean active) {
        return (r, q, cb) -> active == null ? null : cb.equal(r.get("active"), active);
    }

    public static Specification<TradeOrderEntity> all(UUID assetId, String ownerId, OrderType orderType, Boolean active) {
        return Specification.allOf(
                forAsset(assetId),
                ownedBy(ownerId),
                ofType(orderType),
                active(active)
        );
    }
}
