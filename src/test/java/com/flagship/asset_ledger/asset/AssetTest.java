package com.flagship.asset_ledger.asset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AssetTest {

    private static final long NOW = 1_700_000_000L;

    @Test
    @DisplayName("New asset is active, priced at the initial price and never repriced")
    void createSetsInitialState() {
        UUID id = UUID.randomUUID();

        Asset asset = Asset.create(id, "A", AssetType.GOLD, 1000, 99, "C1", 5000, NOW);

        assertEquals(id, asset.getId());
        assertEquals("A", asset.getOwnerId());
        assertEquals(AssetType.GOLD, asset.getAssetType());
        assertEquals(1000, asset.getWeight());
        assertEquals(99, asset.getPurity());
        assertEquals("C1", asset.getCertification());
        assertEquals(5000, asset.getCurrentPrice());
        assertEquals(NOW, asset.getCreatedAt());
        assertEquals(0, asset.getLastPriceUpdate());
        assertTrue(asset.isActive());
    }

    @Test
    @DisplayName("Weight, purity and certification are stored as given")
    void createDoesNotValidatePhysicalAttributes() {
        Asset asset = Asset.create(UUID.randomUUID(), "A", AssetType.DIAMOND, -5, 250, "", 0, NOW);

        assertEquals(-5, asset.getWeight());
        assertEquals(250, asset.getPurity());
        assertEquals("", asset.getCertification());
    }

    @Test
    @DisplayName("Repricing changes only price and last update time")
    void withPriceKeepsEverythingElse() {
        Asset asset = Asset.create(UUID.randomUUID(), "A", AssetType.SILVER, 500, 92, "C2", 100, NOW);

        Asset repriced = asset.withPrice(1, NOW + 60);

        assertEquals(1, repriced.getCurrentPrice());
        assertEquals(NOW + 60, repriced.getLastPriceUpdate());
        assertEquals(asset.getOwnerId(), repriced.getOwnerId());
        assertEquals(asset.getCreatedAt(), repriced.getCreatedAt());
        assertEquals(100, asset.getCurrentPrice(), "original instance must not change");
    }

    @Test
    @DisplayName("Owner change keeps price history intact")
    void withOwnerKeepsPrice() {
        Asset asset = Asset.create(UUID.randomUUID(), "A", AssetType.RUBY, 10, 80, "C3", 700, NOW)
            .withPrice(800, NOW + 1);

        Asset transferred = asset.withOwner("B");

        assertEquals("B", transferred.getOwnerId());
        assertTrue(transferred.isOwnedBy("B"));
        assertFalse(transferred.isOwnedBy("A"));
        assertEquals(800, transferred.getCurrentPrice());
        assertEquals(NOW + 1, transferred.getLastPriceUpdate());
    }
}
