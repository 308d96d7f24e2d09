package com.mirrortrader.domain.model;

import com.mirrortrader.domain.enums.OrderSide;
import com.mirrortrader.domain.enums.OrderStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable view of one mirror order.
 *
 * <p>The {@link com.mirrortrader.oms.OrderTracker} owns every Order and replaces the
 * stored instance on each transition, so an Order handed to a caller is a snapshot
 * that never changes underneath it.
 *
 * <p>Invariant: {@code 0 <= remainingSize <= size}. remainingSize only decreases through
 * fills; a cancel freezes it at whatever was left.
 */
@Value
@Builder(toBuilder = true)
public class Order {

    /** Venue-assigned id. Null while the order is PENDING. */
    Long orderId;

    /** Deterministic correlation key, at most 36 characters. */
    String clientOrderId;

    /** Id of the source wallet's order this order mirrors. */
    Long sourceOrderId;

    String market;
    OrderSide side;
    BigDecimal price;
    BigDecimal size;
    BigDecimal remainingSize;
    OrderStatus status;
    Instant createdAt;
    Instant updatedAt;

    /** Sequence marker of the cancel event that closed the order, if it was canceled from the feed. */
    Long closedSequence;

    public BigDecimal getFilledSize() {
        return size.subtract(remainingSize);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
