package com.mirrortrader.feed;

/** Consumer of raw feed events. Implementations must not throw for a single bad event. */
public interface FeedEventHandler {

    void handle(RawFeedEvent rawEvent);
}
