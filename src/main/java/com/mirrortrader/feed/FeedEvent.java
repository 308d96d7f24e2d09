package com.mirrortrader.feed;

import com.mirrortrader.domain.enums.FeedEventType;

/** A validated domain event. {@link #type()} tags the variant so consumers can switch on it exhaustively. */
public sealed interface FeedEvent permits OrderOpenedEvent, FilledEvent, OrdersClosedEvent {

    FeedEventType type();

    String market();
}
