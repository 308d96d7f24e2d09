package com.mirrortrader.feed;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Transport that delivers raw venue events, at least once, per subscribed market.
 * Reconnection and transport backoff are the implementation's concern.
 */
public interface FeedSource {

    void subscribe(Set<String> markets, Consumer<RawFeedEvent> sink);

    void close();
}
