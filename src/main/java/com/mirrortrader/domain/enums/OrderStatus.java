package com.mirrortrader.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a mirror order.
 *
 * <p>State machine:
 * <pre>
 *   PENDING -> OPEN -> PARTIALLY_FILLED -> FILLED
 *      |        |            |
 *      |        +------------+--> CANCELED
 *      +--> CANCELED | FAILED
 * </pre>
 *
 * <p>PENDING orders have no venue identity yet. FILLED, CANCELED and FAILED are
 * terminal and accept no further transitions.
 */
public enum OrderStatus {
    PENDING,
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELED,
    FAILED;

    private static final Set<OrderStatus> TERMINAL = EnumSet.of(FILLED, CANCELED, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** True once the venue has assigned an order id and the order can trade. */
    public boolean isLive() {
        return this == OPEN || this == PARTIALLY_FILLED;
    }

    public boolean canTransitionTo(OrderStatus target) {
        return switch (this) {
            case PENDING -> target == OPEN || target == CANCELED || target == FAILED;
            case OPEN -> target == PARTIALLY_FILLED || target == FILLED || target == CANCELED;
            case PARTIALLY_FILLED -> target == OPEN
                    || target == PARTIALLY_FILLED
                    || target == FILLED
                    || target == CANCELED;
            case FILLED, CANCELED, FAILED -> false;
        };
    }
}
