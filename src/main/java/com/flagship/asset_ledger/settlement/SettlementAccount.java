package com.flagship.asset_ledger.settlement;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A settlement-token account. Its balance is derived from entries, never stored.
 */
@Value
public class SettlementAccount {
    UUID id;
    String ownerId;
    Instant createdAt;

    public boolean isOwnedBy(String identity) {
        return ownerId.equals(identity);
    }
}
