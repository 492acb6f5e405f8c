package com.flagship.asset_ledger.asset;

import com.flagship.asset_ledger.addressing.RecordAddressService;
import com.flagship.asset_ledger.error.DuplicateAssetException;
import com.flagship.asset_ledger.error.RecordNotFoundException;
import com.flagship.asset_ledger.error.UnauthorizedException;
import com.flagship.asset_ledger.event.AssetCreatedEvent;
import com.flagship.asset_ledger.event.AssetPriceUpdatedEvent;
import com.flagship.asset_ledger.observability.CorrelationContext;
import com.flagship.asset_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Asset Registry: sole writer of asset records.
 *
 * Public operations are creation and owner-only price updates. Ownership
 * changes only through {@link #transferOwnership}, which exists for the trade
 * engine and refuses to run outside the engine's transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetRegistryService {

    private final AssetRepository assetRepository;
    private final RecordAddressService addressService;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;
    private final LedgerMetrics metrics;

    /**
     * Registers a new asset at the address derived from its owner and type.
     *
     * Weight, purity and certification are stored as given.
     *
     * @return the created asset, active, with {@code createdAt = now}
     * @throws DuplicateAssetException if an asset already occupies the derived address
     */
    @Transactional
    public Asset createAsset(String ownerId, AssetType assetType, long weight, int purity,
                             String certification, long initialPrice) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner is required");
        }
        if (assetType == null) {
            throw new IllegalArgumentException("Asset type is required");
        }
        ownerId = ownerId.trim();

        long startTime = System.currentTimeMillis();
        UUID address = addressService.assetAddress(ownerId, assetType.name());
        MDC.put(CorrelationContext.ASSET_ID_MDC_KEY, address.toString());

        try {
            if (assetRepository.existsById(address)) {
                metrics.recordAssetCreated(assetType.name(), "duplicate");
                throw new DuplicateAssetException(address, ownerId, assetType.name());
            }

            long now = clock.instant().getEpochSecond();
            Asset asset = Asset.create(address, ownerId, assetType, weight, purity, certification, initialPrice, now);

            try {
                assetRepository.saveAndFlush(AssetEntity.fromDomain(asset));
            } catch (DataIntegrityViolationException e) {
                // Lost a race for the same address
                metrics.recordAssetCreated(assetType.name(), "duplicate");
                throw new DuplicateAssetException(address, ownerId, assetType.name());
            }

            eventPublisher.publishEvent(AssetCreatedEvent.fromAsset(asset));
            metrics.recordAssetCreated(assetType.name(), "success");
            metrics.recordLatency("create_asset", System.currentTimeMillis() - startTime);

            log.info("Asset created: owner={}, type={}, weight={}, purity={}, price={}",
                    ownerId, assetType, weight, purity, initialPrice);
            return asset;
        } finally {
            MDC.remove(CorrelationContext.ASSET_ID_MDC_KEY);
        }
    }

    /**
     * Sets a new current price. Only the asset's owner may do this.
     *
     * @throws UnauthorizedException if {@code caller} is not the owner; the asset is left unchanged
     * @throws RecordNotFoundException if the asset does not exist
     */
    @Transactional
    public Asset updatePrice(UUID assetId, String caller, long newPrice) {
        MDC.put(CorrelationContext.ASSET_ID_MDC_KEY, assetId.toString());
        try {
            AssetEntity entity = assetRepository.findById(assetId)
                .orElseThrow(() -> RecordNotFoundException.asset(assetId));
            Asset current = entity.toDomain();

            if (caller == null || !current.isOwnedBy(caller.trim())) {
                metrics.recordPriceUpdated("unauthorized");
                throw new UnauthorizedException(caller, "only the owner of asset " + assetId + " may update its price");
            }

            Asset repriced = current.withPrice(newPrice, clock.instant().getEpochSecond());
            entity.applyPrice(repriced);
            assetRepository.save(entity);

            eventPublisher.publishEvent(AssetPriceUpdatedEvent.of(current, repriced));
            metrics.recordPriceUpdated("success");

            log.info("Asset price updated: previousPrice={}, newPrice={}", current.getCurrentPrice(), newPrice);
            return repriced;
        } finally {
            MDC.remove(CorrelationContext.ASSET_ID_MDC_KEY);
        }
    }

    /**
     * Overwrites the asset's owner. No authorization check of its own: callers
     * are expected to have authorized the change inside the same transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Asset transferOwnership(UUID assetId, String newOwner) {
        if (newOwner == null || newOwner.isBlank()) {
            throw new IllegalArgumentException("New owner is required");
        }
        AssetEntity entity = assetRepository.findById(assetId)
            .orElseThrow(() -> RecordNotFoundException.asset(assetId));

        Asset transferred = entity.toDomain().withOwner(newOwner);
        entity.transferTo(transferred);
        assetRepository.save(entity);

        log.debug("Asset {} ownership moved to {}", assetId, newOwner);
        return transferred;
    }

    @Transactional(readOnly = true)
    public Asset getAsset(UUID assetId) {
        return assetRepository.findById(assetId)
            .map(AssetEntity::toDomain)
            .orElseThrow(() -> RecordNotFoundException.asset(assetId));
    }

    /**
     * Lists assets matching every non-null filter, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Asset> listAssets(String ownerId, AssetType assetType, Boolean active) {
        return assetRepository.findAll(AssetSpecifications.all(ownerId, assetType, active),
                Sort.by(Sort.Direction.ASC, "createdAt"))
            .stream()
            .map(AssetEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countActiveAssets() {
        return assetRepository.countByActiveTrue();
    }

    @Transactional(readOnly = true)
    public BigInteger totalActiveValue() {
        BigInteger total = assetRepository.totalActiveValue();
        return total != null ? total : BigInteger.ZERO;
    }

    @Transactional(readOnly = true)
    public Map<AssetType, Long> countActiveByType() {
        Map<AssetType, Long> counts = new EnumMap<>(AssetType.class);
        for (Object[] row : assetRepository.countActiveByType()) {
            counts.put((AssetType) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
}
