package com.flagship.asset_ledger.settlement;

import com.flagship.asset_ledger.settlement.dto.DepositRequest;
import com.flagship.asset_ledger.settlement.dto.DepositResponse;
import com.flagship.asset_ledger.settlement.dto.OpenAccountRequest;
import com.flagship.asset_ledger.settlement.dto.SettlementAccountResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Settlement-token accounts used to pay for trades.
 */
@RestController
@RequestMapping("/api/settlement/accounts")
@RequiredArgsConstructor
public class SettlementController {

    private final SettlementAccountService accountService;

    @PostMapping
    public ResponseEntity<SettlementAccountResponse> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        SettlementAccount account = accountService.openAccount(request.getOwnerId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(SettlementAccountResponse.from(account, 0L));
    }

    @PostMapping("/{id}/deposits")
    public ResponseEntity<DepositResponse> deposit(@PathVariable("id") UUID id,
                                                   @Valid @RequestBody DepositRequest request) {
        UUID transferId = accountService.deposit(id, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(DepositResponse.builder()
                .transferId(transferId)
                .accountId(id)
                .balance(accountService.balanceOf(id))
                .build());
    }

    @GetMapping("/{id}")
    public ResponseEntity<SettlementAccountResponse> getAccount(@PathVariable("id") UUID id) {
        SettlementAccount account = accountService.getAccount(id);
        return ResponseEntity.ok(SettlementAccountResponse.from(account, accountService.balanceOf(id)));
    }
}
