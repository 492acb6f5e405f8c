package com.flagship.asset_ledger.order;

import com.flagship.asset_ledger.addressing.RecordAddressService;
import com.flagship.asset_ledger.error.RecordNotFoundException;
import com.flagship.asset_ledger.event.OrderCreatedEvent;
import com.flagship.asset_ledger.observability.CorrelationContext;
import com.flagship.asset_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Order Book: sole writer of trade order records.
 *
 * Orders are created freely; the only other write is {@link #deactivate},
 * which the trade engine calls inside its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderBookService {

    private final TradeOrderRepository orderRepository;
    private final RecordAddressService addressService;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;
    private final LedgerMetrics metrics;

    /**
     * Places a new active order.
     *
     * Neither the asset reference nor the quantity is validated here; an
     * order with zero quantity can be placed but never executed.
     *
     * @throws IllegalStateException if the derived address already holds an order
     */
    @Transactional
    public TradeOrder createOrder(UUID assetRef, String ownerId, OrderType orderType,
                                  long quantity, long pricePerUnit) {
        if (assetRef == null) {
            throw new IllegalArgumentException("Asset reference is required");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner is required");
        }
        if (orderType == null) {
            throw new IllegalArgumentException("Order type is required");
        }
        ownerId = ownerId.trim();

        long now = clock.instant().getEpochSecond();
        UUID address = addressService.orderAddress(ownerId, now);
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, address.toString());

        try {
            if (orderRepository.existsById(address)) {
                throw new IllegalStateException("Trade order already exists at address " + address);
            }

            TradeOrder order = TradeOrder.create(address, assetRef, ownerId, orderType, quantity, pricePerUnit, now);
            orderRepository.saveAndFlush(TradeOrderEntity.fromDomain(order));

            eventPublisher.publishEvent(OrderCreatedEvent.fromOrder(order));
            metrics.recordOrderCreated(orderType.name());

            log.info("Trade order created: asset={}, owner={}, type={}, quantity={}, pricePerUnit={}",
                    assetRef, ownerId, orderType, quantity, pricePerUnit);
            return order;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    /**
     * Consumes the order: quantity drops to 0 and the order becomes inactive.
     *
     * @throws IllegalStateException if the order is already consumed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TradeOrder deactivate(UUID orderId) {
        TradeOrderEntity entity = orderRepository.findById(orderId)
            .orElseThrow(() -> RecordNotFoundException.order(orderId));

        TradeOrder consumed = entity.toDomain().consume();
        entity.consume(consumed);
        orderRepository.save(entity);

        log.debug("Trade order {} consumed", orderId);
        return consumed;
    }

    @Transactional(readOnly = true)
    public TradeOrder getOrder(UUID orderId) {
        return orderRepository.findById(orderId)
            .map(TradeOrderEntity::toDomain)
            .orElseThrow(() -> RecordNotFoundException.order(orderId));
    }

    /**
     * Lists orders matching every non-null filter, oldest first.
     */
    @Transactional(readOnly = true)
    public List<TradeOrder> listOrders(UUID assetRef, String ownerId, OrderType orderType, Boolean active) {
        return orderRepository.findAll(OrderSpecifications.all(assetRef, ownerId, orderType, active),
                Sort.by(Sort.Direction.ASC, "createdAt"))
            .stream()
            .map(TradeOrderEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countActiveOrders() {
        return orderRepository.countByActiveTrue();
    }
}
