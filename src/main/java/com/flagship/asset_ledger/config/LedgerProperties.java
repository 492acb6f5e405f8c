package com.flagship.asset_ledger.config;

import com.flagship.asset_ledger.addressing.AssetAddressScheme;
import com.flagship.asset_ledger.trade.SettlementAmountMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings under the {@code ledger.*} namespace.
 */
@Component
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private Addressing addressing = new Addressing();
    private Settlement settlement = new Settlement();
    private Events events = new Events();

    @Getter
    @Setter
    public static class Addressing {
        /**
         * How asset addresses are derived. OWNER_AND_TYPE allows one asset per
         * owner and type; OWNER_SEQUENCE adds a per-owner counter.
         */
        private AssetAddressScheme assetScheme = AssetAddressScheme.OWNER_SEQUENCE;
    }

    @Getter
    @Setter
    public static class Settlement {
        /**
         * Amount moved by the settlement transfer of a trade.
         */
        private SettlementAmountMode amountMode = SettlementAmountMode.QUANTITY;
    }

    @Getter
    @Setter
    public static class Events {
        private boolean enabled = true;
        private String topic = "asset-ledger-events";
    }
}
