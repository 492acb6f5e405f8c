package com.flagship.asset_ledger.settlement;

/**
 * Side of a settlement entry. Credits increase an account's balance, debits decrease it.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
