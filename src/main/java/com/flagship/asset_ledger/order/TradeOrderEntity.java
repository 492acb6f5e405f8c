package com.flagship.asset_ledger.order;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * JPA entity for the trade order record.
 *
 * The only mutation is {@link #consume}, applied by the order book when a
 * trade executes.
 */
@Entity
@Table(
    name = "trade_orders",
    indexes = {
        @Index(name = "idx_trade_orders_asset_ref", columnList = "asset_ref"),
        @Index(name = "idx_trade_orders_owner_id", columnList = "owner_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TradeOrderEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "asset_ref", nullable = false, updatable = false)
    private UUID assetRef;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", nullable = false, updatable = false, length = 8)
    private OrderType orderType;

    @Column(nullable = false)
    private long quantity;

    @Column(name = "price_per_unit", nullable = false, updatable = false)
    private long pricePerUnit;

    @Column(name = "created_at", nullable = false, updatable = false)
    private long createdAt;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    static TradeOrderEntity fromDomain(TradeOrder order) {
        return new TradeOrderEntity(
            order.getId(),
            order.getAssetRef(),
            order.getOwnerId(),
            order.getOrderType(),
            order.getQuantity(),
            order.getPricePerUnit(),
            order.getCreatedAt(),
            order.isActive()
        );
    }

    public TradeOrder toDomain() {
        return new TradeOrder(id, assetRef, ownerId, orderType, quantity, pricePerUnit, createdAt, active);
    }

    void consume(TradeOrder consumed) {
        this.quantity = consumed.getQuantity();
        this.active = consumed.isActive();
    }
}
