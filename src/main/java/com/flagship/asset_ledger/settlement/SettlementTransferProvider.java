package com.flagship.asset_ledger.settlement;

import java.util.UUID;

/**
 * Moves settlement-token units between two accounts.
 *
 * Implementations join the caller's transaction: a failure thrown from
 * {@link #transfer} leaves no movement behind and aborts the caller's unit of work.
 */
public interface SettlementTransferProvider {

    /**
     * @param authority identity that must own {@code source}
     * @return id of the recorded transfer
     * @throws com.flagship.asset_ledger.error.InsufficientFundsException if the source balance is below {@code amount}
     * @throws com.flagship.asset_ledger.error.UnauthorizedException if {@code authority} does not own {@code source}
     * @throws com.flagship.asset_ledger.error.RecordNotFoundException if either account does not exist
     */
    UUID transfer(UUID source, UUID destination, long amount, String authority);
}
