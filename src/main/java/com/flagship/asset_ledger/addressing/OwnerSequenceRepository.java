package com.flagship.asset_ledger.addressing;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Per-owner monotonically increasing counters, one per record kind.
 *
 * JDBC rather than JPA: the increment is a single upsert that must be atomic
 * inside the caller's transaction.
 */
@Repository
public class OwnerSequenceRepository {

    private final JdbcTemplate jdbcTemplate;

    public OwnerSequenceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns the next value for the owner's counter, starting at 1.
     */
    public long next(String ownerId, RecordKind kind) {
        Long value = jdbcTemplate.queryForObject(
            "INSERT INTO owner_sequences (owner_id, record_kind, last_value) VALUES (?, ?, 1) " +
            "ON CONFLICT (owner_id, record_kind) " +
            "DO UPDATE SET last_value = owner_sequences.last_value + 1 " +
            "RETURNING last_value",
            Long.class,
            ownerId,
            kind.name()
        );
        if (value == null) {
            throw new IllegalStateException("Sequence upsert returned no value for owner " + ownerId);
        }
        return value;
    }

    public enum RecordKind {
        ASSET,
        ORDER
    }
}
