package com.flagship.asset_ledger.asset;

/**
 * Closed set of materials the registry accepts.
 */
public enum AssetType {
    GOLD,
    SILVER,
    PLATINUM,
    PALLADIUM,
    DIAMOND,
    RUBY,
    EMERALD,
    SAPPHIRE
}
