package com.mirrortrader.feed;

import com.mirrortrader.domain.enums.FeedEventType;
import java.time.Instant;
import java.util.List;

/**
 * Orders of one owner were canceled on the venue.
 *
 * @param sequenceMarker feed position of the cancel, null when the payload carries none
 */
public record OrdersClosedEvent(
        String market, List<Long> orderIds, String owner, Long sequenceMarker, Instant observedAt)
        implements FeedEvent {

    public OrdersClosedEvent {
        orderIds = List.copyOf(orderIds);
    }

    @Override
    public FeedEventType type() {
        return FeedEventType.ORDERS_CLOSED;
    }
}
