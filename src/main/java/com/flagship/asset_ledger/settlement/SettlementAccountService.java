package com.flagship.asset_ledger.settlement;

import com.flagship.asset_ledger.error.RecordNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Opens and funds settlement accounts.
 *
 * Deposits are issued from the system issuer account, whose balance goes
 * negative by the total amount issued.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementAccountService {

    public static final UUID ISSUER_ACCOUNT_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
    public static final String ISSUER_OWNER = "system:issuer";

    private final SettlementLedger ledger;

    @Transactional
    public SettlementAccount openAccount(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner is required");
        }
        ownerId = ownerId.trim();
        UUID accountId = UUID.randomUUID();
        ledger.createAccount(accountId, ownerId);
        log.info("Settlement account opened: accountId={}, owner={}", accountId, ownerId);
        return ledger.findAccount(accountId)
            .orElseThrow(() -> new IllegalStateException("Settlement account not found after insert: " + accountId));
    }

    /**
     * Credits {@code amount} units to the account.
     *
     * @return id of the issuing transfer
     */
    @Transactional
    public UUID deposit(UUID accountId, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Deposit amount must be positive: " + amount);
        }
        getAccount(accountId);

        UUID transferId = ledger.post(LedgerPosting.transfer(ISSUER_ACCOUNT_ID, accountId, amount,
                ISSUER_OWNER, "Deposit"));
        log.info("Deposit posted: accountId={}, amount={}, transferId={}", accountId, amount, transferId);
        return transferId;
    }

    @Transactional(readOnly = true)
    public SettlementAccount getAccount(UUID accountId) {
        return ledger.findAccount(accountId)
            .orElseThrow(() -> RecordNotFoundException.settlementAccount(accountId));
    }

    @Transactional(readOnly = true)
    public long balanceOf(UUID accountId) {
        getAccount(accountId);
        return ledger.balanceOf(accountId);
    }
}
