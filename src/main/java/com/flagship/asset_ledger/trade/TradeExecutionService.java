package com.flagship.asset_ledger.trade;

import com.flagship.asset_ledger.asset.Asset;
import com.flagship.asset_ledger.asset.AssetRegistryService;
import com.flagship.asset_ledger.auth.AuthorizationProvider;
import com.flagship.asset_ledger.auth.TransactionSigners;
import com.flagship.asset_ledger.config.LedgerProperties;
import com.flagship.asset_ledger.error.AssetMismatchException;
import com.flagship.asset_ledger.error.InvalidQuantityException;
import com.flagship.asset_ledger.error.LedgerException;
import com.flagship.asset_ledger.error.OrderInactiveException;
import com.flagship.asset_ledger.error.UnauthorizedException;
import com.flagship.asset_ledger.event.TradeExecutedEvent;
import com.flagship.asset_ledger.observability.CorrelationContext;
import com.flagship.asset_ledger.observability.LedgerMetrics;
import com.flagship.asset_ledger.order.OrderBookService;
import com.flagship.asset_ledger.order.TradeOrder;
import com.flagship.asset_ledger.settlement.SettlementTransferProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

/**
 * Executes a trade: settlement, order consumption and ownership transfer as
 * one all-or-nothing unit.
 *
 * Preconditions are checked in a fixed order before anything is written:
 * 1. order and asset exist
 * 2. order is active
 * 3. order quantity is positive
 * 4. order refers to the presented asset
 * 5. the order owner is who the caller says, and both order owner and buyer co-signed
 *
 * Effects, in order:
 * 1. settlement transfer from source to destination, authority = order owner
 * 2. order consumed (quantity 0, inactive)
 * 3. asset owner set to buyer
 *
 * Any failure, including a settlement failure after the checks, rolls the
 * whole transaction back. The engine holds no locks of its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeExecutionService {

    private final OrderBookService orderBookService;
    private final AssetRegistryService assetRegistryService;
    private final SettlementTransferProvider settlementTransferProvider;
    private final AuthorizationProvider authorizationProvider;
    private final LedgerProperties properties;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;
    private final LedgerMetrics metrics;

    @Transactional
    public TradeExecution executeTrade(ExecuteTradeCommand command, TransactionSigners signers) {
        command.validate();

        long startTime = System.currentTimeMillis();
        UUID orderId = command.getOrderId();
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, orderId.toString());
        MDC.put(CorrelationContext.ASSET_ID_MDC_KEY, command.getAssetId().toString());

        try {
            TradeOrder order = orderBookService.getOrder(orderId);
            Asset asset = assetRegistryService.getAsset(command.getAssetId());

            checkPreconditions(command, order, signers);

            long amount = properties.getSettlement().getAmountMode().amountFor(order);
            UUID transferId = settlementTransferProvider.transfer(
                command.getSettlementSource(),
                command.getSettlementDestination(),
                amount,
                command.getOrderOwner()
            );

            orderBookService.deactivate(orderId);
            assetRegistryService.transferOwnership(asset.getId(), command.getBuyer());

            TradeExecution execution = new TradeExecution(
                orderId,
                asset.getId(),
                asset.getOwnerId(),
                command.getBuyer(),
                amount,
                transferId,
                clock.instant().getEpochSecond()
            );

            eventPublisher.publishEvent(TradeExecutedEvent.fromExecution(execution));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTradeExecuted("success");
            metrics.recordLatency("execute_trade", duration);

            log.info("Trade executed: seller={}, buyer={}, settledAmount={}, transferId={}, duration={}ms",
                    execution.getSeller(), execution.getBuyer(), amount, transferId, duration);
            return execution;

        } catch (LedgerException e) {
            metrics.recordTradeExecuted(e.getCode().name().toLowerCase(Locale.ROOT));
            log.warn("Trade rejected: code={}, reason={}", e.getCode(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ASSET_ID_MDC_KEY);
        }
    }

    private void checkPreconditions(ExecuteTradeCommand command, TradeOrder order, TransactionSigners signers) {
        if (!order.isActive()) {
            throw new OrderInactiveException(order.getId());
        }
        if (order.getQuantity() <= 0) {
            throw new InvalidQuantityException(order.getId(), order.getQuantity());
        }
        if (!order.refersTo(command.getAssetId())) {
            throw new AssetMismatchException(order.getId(), order.getAssetRef(), command.getAssetId());
        }
        if (!order.isOwnedBy(command.getOrderOwner())) {
            throw new UnauthorizedException(command.getOrderOwner(), "does not own order " + order.getId());
        }
        authorizationProvider.requireCoSigners(signers, command.getOrderOwner(), command.getBuyer());
    }
}
