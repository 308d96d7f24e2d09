package com.mirrortrader.feed;

import com.mirrortrader.domain.enums.FeedEventType;
import com.mirrortrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * A source wallet placed a limit order.
 *
 * @param clientOrderId the source's own correlation id, null when the venue did not report one
 */
public record OrderOpenedEvent(
        String market,
        long sourceOrderId,
        String owner,
        OrderSide side,
        BigDecimal price,
        BigDecimal size,
        String clientOrderId,
        Instant observedAt)
        implements FeedEvent {

    @Override
    public FeedEventType type() {
        return FeedEventType.ORDER_OPENED;
    }
}
