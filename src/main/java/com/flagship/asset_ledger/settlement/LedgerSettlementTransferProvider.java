package com.flagship.asset_ledger.settlement;

import com.flagship.asset_ledger.error.InsufficientFundsException;
import com.flagship.asset_ledger.error.RecordNotFoundException;
import com.flagship.asset_ledger.error.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * {@link SettlementTransferProvider} backed by the {@link SettlementLedger}.
 *
 * Checks, in order: argument sanity, both accounts exist, the authority owns
 * the source, the source balance covers the amount. Only then is a balanced
 * debit/credit pair posted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerSettlementTransferProvider implements SettlementTransferProvider {

    private final SettlementLedger ledger;

    @Override
    @Transactional
    public UUID transfer(UUID source, UUID destination, long amount, String authority) {
        if (source == null || destination == null) {
            throw new IllegalArgumentException("Source and destination accounts are required");
        }
        if (source.equals(destination)) {
            throw new IllegalArgumentException("Source and destination must differ: " + source);
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Transfer amount must be positive: " + amount);
        }

        SettlementAccount sourceAccount = ledger.lockAccount(source)
            .orElseThrow(() -> RecordNotFoundException.settlementAccount(source));
        ledger.findAccount(destination)
            .orElseThrow(() -> RecordNotFoundException.settlementAccount(destination));

        if (!sourceAccount.isOwnedBy(authority)) {
            log.warn("Settlement transfer rejected: authority={} does not own source={}", authority, source);
            throw new UnauthorizedException(authority, "does not own settlement account " + source);
        }

        long available = ledger.balanceOf(source);
        if (available < amount) {
            log.warn("Settlement transfer rejected: source={}, requested={}, available={}",
                    source, amount, available);
            throw new InsufficientFundsException(source, amount, available);
        }

        UUID transferId = ledger.post(LedgerPosting.transfer(source, destination, amount, authority,
                "Trade settlement"));

        log.info("Settlement transfer posted: transferId={}, source={}, destination={}, amount={}",
                transferId, source, destination, amount);
        return transferId;
    }
}
