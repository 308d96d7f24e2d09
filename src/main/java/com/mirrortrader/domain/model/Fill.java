package com.mirrortrader.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An observed execution against a venue order.
 *
 * <p>Fills are idempotent by {@code (market, orderId, sequenceMarker)}: the feed delivers at least
 * once, so the same key may arrive more than once and must only count once.
 */
public record Fill(long orderId, BigDecimal filledSize, BigDecimal price, long sequenceMarker, Instant observedAt) {

    public String dedupKey() {
        return orderId + ":" + sequenceMarker;
    }
}
