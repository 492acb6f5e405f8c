package com.flagship.asset_ledger.market;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
public class MarketController {

    private final MarketSummaryService marketSummaryService;

    @GetMapping("/summary")
    public ResponseEntity<MarketSummary> summary() {
        return ResponseEntity.ok(marketSummaryService.summary());
    }
}
