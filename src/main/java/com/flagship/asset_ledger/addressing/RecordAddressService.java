package com.flagship.asset_ledger.addressing;

import com.flagship.asset_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Derives deterministic record addresses from the identities that own them.
 *
 * Addresses are name-based UUIDs, so the same inputs always give the same
 * address. Collision avoidance comes from what goes into the name:
 * - assets: owner + type, plus a per-owner sequence under OWNER_SEQUENCE
 * - orders: owner + creation second + per-owner sequence
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordAddressService {

    private final OwnerSequenceRepository sequenceRepository;
    private final LedgerProperties properties;

    public UUID assetAddress(String ownerId, String assetType) {
        AssetAddressScheme scheme = properties.getAddressing().getAssetScheme();
        UUID address = switch (scheme) {
            case OWNER_AND_TYPE -> derive("asset", ownerId, assetType);
            case OWNER_SEQUENCE -> derive("asset", ownerId, assetType,
                Long.toString(sequenceRepository.next(ownerId, OwnerSequenceRepository.RecordKind.ASSET)));
        };
        log.debug("Derived asset address {} for owner={}, type={}, scheme={}", address, ownerId, assetType, scheme);
        return address;
    }

    public UUID orderAddress(String ownerId, long createdAt) {
        long sequence = sequenceRepository.next(ownerId, OwnerSequenceRepository.RecordKind.ORDER);
        return derive("order", ownerId, Long.toString(createdAt), Long.toString(sequence));
    }

    static UUID derive(String... parts) {
        return UUID.nameUUIDFromBytes(String.join(":", parts).getBytes(StandardCharsets.UTF_8));
    }
}
