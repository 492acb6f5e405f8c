package com.flagship.asset_ledger.settlement;

import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A set of debits and credits posted as one settlement transfer.
 *
 * Invariant: sum of debits equals sum of credits.
 */
@Value
public class LedgerPosting {
    String description;
    String authority;
    List<Leg> debits;
    List<Leg> credits;

    /**
     * A posting that moves {@code amount} from {@code source} to {@code destination}.
     */
    public static LedgerPosting transfer(UUID source, UUID destination, long amount,
                                         String authority, String description) {
        return new LedgerPosting(
            description,
            authority,
            List.of(Leg.of(source, amount)),
            List.of(Leg.of(destination, amount))
        );
    }

    public boolean isBalanced() {
        return getDebitTotal() == getCreditTotal();
    }

    public long getDebitTotal() {
        return debits.stream().mapToLong(Leg::getAmount).reduce(0L, Math::addExact);
    }

    public long getCreditTotal() {
        return credits.stream().mapToLong(Leg::getAmount).reduce(0L, Math::addExact);
    }

    @Value
    public static class Leg {
        UUID accountId;
        long amount;

        private Leg(UUID accountId, long amount) {
            this.accountId = Objects.requireNonNull(accountId);
            if (amount <= 0) {
                throw new IllegalArgumentException("Amount must be positive");
            }
            this.amount = amount;
        }

        public static Leg of(UUID accountId, long amount) {
            return new Leg(accountId, amount);
        }
    }
}
