package com.mirrortrader.oms;

import com.mirrortrader.domain.model.Order;
import java.math.BigDecimal;

/**
 * Result of offering a fill to the {@link OrderTracker}.
 *
 * @param order the order after the fill (APPLIED) or as it stood (DUPLICATE, TERMINAL_IGNORED);
 *     null for UNKNOWN_ORDER
 * @param appliedSize quantity actually applied, which is less than the fill size when capped
 * @param capped true when the fill would have overrun the order size
 */
public record FillOutcome(Kind kind, Order order, BigDecimal appliedSize, boolean capped) {

    public enum Kind {
        APPLIED,
        DUPLICATE,
        UNKNOWN_ORDER,
        TERMINAL_IGNORED
    }

    static FillOutcome applied(Order order, BigDecimal appliedSize, boolean capped) {
        return new FillOutcome(Kind.APPLIED, order, appliedSize, capped);
    }

    static FillOutcome duplicate(Order order) {
        return new FillOutcome(Kind.DUPLICATE, order, BigDecimal.ZERO, false);
    }

    static FillOutcome unknownOrder() {
        return new FillOutcome(Kind.UNKNOWN_ORDER, null, BigDecimal.ZERO, false);
    }

    static FillOutcome terminalIgnored(Order order) {
        return new FillOutcome(Kind.TERMINAL_IGNORED, order, BigDecimal.ZERO, false);
    }

    public boolean isApplied() {
        return kind == Kind.APPLIED;
    }
}
