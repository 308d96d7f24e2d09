package com.mirrortrader.feed;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * One payload as delivered by the feed, before any validation.
 *
 * @param market subscription key the payload arrived on; also the dispatch partition
 * @param eventType venue event name, e.g. OrderCreated, Trade, OrdersCanceled
 */
public record RawFeedEvent(String market, String eventType, JsonNode payload, Instant receivedAt) {}
