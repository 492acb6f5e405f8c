package com.flagship.asset_ledger.settlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Double-entry store behind the settlement adapter.
 *
 * Invariants:
 * 1. Every transfer's debits equal its credits (checked here and by a
 *    deferred database trigger at commit)
 * 2. Entries are immutable once written
 * 3. Balances are derived from entries: credits minus debits
 *
 * Plain JDBC; the settlement tables have no JPA mapping.
 */
@Service
@Slf4j
public class SettlementLedger {

    private final JdbcTemplate jdbcTemplate;

    public SettlementLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Records a posting as one transfer with its entries.
     *
     * @return the id of the created transfer
     * @throws IllegalArgumentException if the posting is not balanced
     */
    @Transactional
    public UUID post(LedgerPosting posting) {
        if (!posting.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Posting is not balanced: debits=%d, credits=%d",
                    posting.getDebitTotal(), posting.getCreditTotal()));
        }

        UUID transferId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO settlement_transfers (id, authority, amount, description, created_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transferId,
            posting.getAuthority(),
            posting.getDebitTotal(),
            posting.getDescription()
        );

        for (LedgerPosting.Leg debit : posting.getDebits()) {
            insertEntry(transferId, debit, EntryType.DEBIT);
        }
        for (LedgerPosting.Leg credit : posting.getCredits()) {
            insertEntry(transferId, credit, EntryType.CREDIT);
        }

        log.debug("Posted settlement transfer {}: amount={}", transferId, posting.getDebitTotal());
        return transferId;
    }

    private void insertEntry(UUID transferId, LedgerPosting.Leg leg, EntryType entryType) {
        jdbcTemplate.update(
            "INSERT INTO settlement_entries (id, transfer_id, account_id, amount, entry_type, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transferId,
            leg.getAccountId(),
            leg.getAmount(),
            entryType.name()
        );
    }

    public void createAccount(UUID accountId, String ownerId) {
        jdbcTemplate.update(
            "INSERT INTO settlement_accounts (id, owner_id, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
            accountId,
            ownerId
        );
    }

    public Optional<SettlementAccount> findAccount(UUID accountId) {
        List<SettlementAccount> found = jdbcTemplate.query(
            "SELECT id, owner_id, created_at FROM settlement_accounts WHERE id = ?",
            accountRowMapper(),
            accountId
        );
        return found.stream().findFirst();
    }

    /**
     * Like {@link #findAccount} but holds a row lock on the account until the
     * surrounding transaction ends, so that two transfers out of one account
     * cannot both pass the funds check.
     */
    public Optional<SettlementAccount> lockAccount(UUID accountId) {
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(
                "SELECT id, owner_id, created_at FROM settlement_accounts WHERE id = ? FOR UPDATE",
                accountRowMapper(),
                accountId
            ));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    public long balanceOf(UUID accountId) {
        Long balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN entry_type = 'CREDIT' THEN amount ELSE -amount END), 0) " +
            "FROM settlement_entries WHERE account_id = ?",
            Long.class,
            accountId
        );
        return balance != null ? balance : 0L;
    }

    public List<LedgerEntry> entriesForTransfer(UUID transferId) {
        return jdbcTemplate.query(
            "SELECT id, transfer_id, account_id, amount, entry_type, sequence_number " +
            "FROM settlement_entries WHERE transfer_id = ? ORDER BY sequence_number",
            entryRowMapper(),
            transferId
        );
    }

    public long countTransfers() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM settlement_transfers", Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Transfers whose entries do not net to zero. Always 0 unless the trigger was bypassed.
     */
    public long countUnbalancedTransfers() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM (" +
            "  SELECT transfer_id FROM settlement_entries GROUP BY transfer_id " +
            "  HAVING SUM(CASE WHEN entry_type = 'DEBIT' THEN amount ELSE -amount END) <> 0" +
            ") unbalanced",
            Long.class
        );
        return count != null ? count : 0L;
    }

    private RowMapper<SettlementAccount> accountRowMapper() {
        return (rs, rowNum) -> new SettlementAccount(
            rs.getObject("id", UUID.class),
            rs.getString("owner_id"),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private RowMapper<LedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("transfer_id", UUID.class),
            rs.getObject("account_id", UUID.class),
            rs.getLong("amount"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getLong("sequence_number")
        );
    }
}
