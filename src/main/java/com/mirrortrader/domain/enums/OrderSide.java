package com.mirrortrader.domain.enums;

import java.math.BigDecimal;

/** Buy or sell side of an order. Maps to the venue's is_buy flag. */
public enum OrderSide {
    BUY,
    SELL;

    public static OrderSide fromBuyFlag(boolean isBuy) {
        return isBuy ? BUY : SELL;
    }

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** Signs a quantity: positive for BUY, negative for SELL. */
    public BigDecimal signed(BigDecimal quantity) {
        return this == BUY ? quantity : quantity.negate();
    }
}
