package com.flagship.asset_ledger.settlement;

import lombok.Value;

import java.util.UUID;

/**
 * One side of a settlement transfer. Entries are written once and never updated.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transferId;
    UUID accountId;
    long amount;
    EntryType entryType;
    long sequenceNumber;
}
