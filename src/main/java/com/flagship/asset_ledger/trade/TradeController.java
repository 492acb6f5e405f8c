package com.flagship.asset_ledger.trade;

import com.flagship.asset_ledger.auth.TransactionSigners;
import com.flagship.asset_ledger.trade.dto.ExecuteTradeRequest;
import com.flagship.asset_ledger.trade.dto.TradeExecutionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for trade execution.
 *
 * Co-signers are read from the {@code X-Signers} header as a comma separated
 * list of identities. A missing header means nobody signed.
 */
@RestController
@RequestMapping("/api/trades")
@RequiredArgsConstructor
@Slf4j
public class TradeController {

    private final TradeExecutionService tradeExecutionService;

    @PostMapping
    public ResponseEntity<TradeExecutionResponse> executeTrade(
            @Valid @RequestBody ExecuteTradeRequest request,
            @RequestHeader(name = TransactionSigners.HEADER, required = false) String signersHeader) {

        TransactionSigners signers = TransactionSigners.parse(signersHeader);
        log.info("Received trade execution: order={}, asset={}, buyer={}, signers={}",
                request.getOrderId(), request.getAssetId(), request.getBuyer(), signers.getIdentities());

        TradeExecution execution = tradeExecutionService.executeTrade(request.toCommand(), signers);
        return ResponseEntity.ok(TradeExecutionResponse.from(execution));
    }
}
