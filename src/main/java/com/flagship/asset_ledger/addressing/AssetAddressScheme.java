package com.flagship.asset_ledger.addressing;

/**
 * Derivation scheme for asset record addresses.
 */
public enum AssetAddressScheme {
    /**
     * Address derived from owner and asset type only.
     * An owner can hold at most one asset of each type; a second create collides.
     */
    OWNER_AND_TYPE,

    /**
     * Address derived from owner, asset type and a per-owner sequence number.
     * Every create lands on a fresh address.
     */
    OWNER_SEQUENCE
}
