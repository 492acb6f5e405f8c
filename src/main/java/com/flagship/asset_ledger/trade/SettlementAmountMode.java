package com.flagship.asset_ledger.trade;

import com.flagship.asset_ledger.error.AmountOverflowException;
import com.flagship.asset_ledger.order.TradeOrder;

/**
 * How many settlement units a trade moves.
 */
public enum SettlementAmountMode {

    /**
     * The order quantity, independent of the unit price.
     */
    QUANTITY {
        @Override
        public long amountFor(TradeOrder order) {
            return order.getQuantity();
        }
    },

    /**
     * Quantity times unit price.
     *
     * @throws AmountOverflowException if the product does not fit in a long
     */
    NOTIONAL {
        @Override
        public long amountFor(TradeOrder order) {
            try {
                return Math.multiplyExact(order.getQuantity(), order.getPricePerUnit());
            } catch (ArithmeticException e) {
                throw new AmountOverflowException(order.getId(), order.getQuantity(), order.getPricePerUnit());
            }
        }
    };

    public abstract long amountFor(TradeOrder order);
}
