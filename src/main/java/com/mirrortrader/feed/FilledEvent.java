package com.mirrortrader.feed;

import com.mirrortrader.domain.enums.FeedEventType;
import com.mirrortrader.domain.model.Fill;

/** An execution against a venue order, which may or may not be one of ours. */
public record FilledEvent(String market, Fill fill) implements FeedEvent {

    @Override
    public FeedEventType type() {
        return FeedEventType.FILLED;
    }
}
