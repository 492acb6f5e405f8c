package com.flagship.asset_ledger.market;

import com.flagship.asset_ledger.asset.AssetRegistryService;
import com.flagship.asset_ledger.order.OrderBookService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

@Service
@RequiredArgsConstructor
public class MarketSummaryService {

    private final AssetRegistryService assetRegistryService;
    private final OrderBookService orderBookService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public MarketSummary summary() {
        return MarketSummary.builder()
            .totalAssets(assetRegistryService.countActiveAssets())
            .totalValue(assetRegistryService.totalActiveValue())
            .activeOrders(orderBookService.countActiveOrders())
            .assetsByType(assetRegistryService.countActiveByType())
            .timestamp(clock.instant())
            .build();
    }
}
