package com.flagship.asset_ledger.health;

import com.flagship.asset_ledger.settlement.SettlementLedger;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Down if any settlement transfer's entries fail to net to zero.
 */
@Component("settlementLedgerHealth")
public class SettlementLedgerHealthIndicator implements HealthIndicator {

    private final SettlementLedger settlementLedger;

    public SettlementLedgerHealthIndicator(SettlementLedger settlementLedger) {
        this.settlementLedger = settlementLedger;
    }

    @Override
    public Health health() {
        try {
            long unbalanced = settlementLedger.countUnbalancedTransfers();

            Health.Builder builder = unbalanced == 0 ? Health.up() : Health.down();
            return builder
                    .withDetail("transfers", settlementLedger.countTransfers())
                    .withDetail("unbalancedTransfers", unbalanced)
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
