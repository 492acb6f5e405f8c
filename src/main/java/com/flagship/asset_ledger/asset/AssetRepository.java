package com.flagship.asset_ledger.asset;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

@Repository
public interface AssetRepository extends JpaRepository<AssetEntity, UUID>, JpaSpecificationExecutor<AssetEntity> {

    long countByActiveTrue();

    /**
     * Sum of price times weight over active assets; null when there are none.
     * Computed as numeric so a large price times weight cannot overflow bigint.
     */
    @Query("SELECT SUM(CAST(a.currentPrice AS BigInteger) * a.weight) FROM AssetEntity a WHERE a.active = true")
    BigInteger totalActiveValue();

    /**
     * Rows of [AssetType, Long count] for active assets.
     */
    @Query("SELECT a.assetType, COUNT(a) FROM AssetEntity a WHERE a.active = true GROUP BY a.assetType")
    List<Object[]> countActiveByType();
}
