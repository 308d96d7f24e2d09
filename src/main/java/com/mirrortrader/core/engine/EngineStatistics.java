package com.mirrortrader.core.engine;

import java.util.concurrent.atomic.AtomicLong;

/** Running counters of what the engine has done since startup. */
public class EngineStatistics {

    private final AtomicLong ordersDetected = new AtomicLong();
    private final AtomicLong ordersMirrored = new AtomicLong();
    private final AtomicLong ordersQueued = new AtomicLong();
    private final AtomicLong ordersRejected = new AtomicLong();
    private final AtomicLong ordersCanceled = new AtomicLong();
    private final AtomicLong fillsApplied = new AtomicLong();

    void orderDetected() {
        ordersDetected.incrementAndGet();
    }

    void orderMirrored() {
        ordersMirrored.incrementAndGet();
    }

    void orderQueued() {
        ordersQueued.incrementAndGet();
    }

    void orderRejected() {
        ordersRejected.incrementAndGet();
    }

    void orderCanceled() {
        ordersCanceled.incrementAndGet();
    }

    void fillApplied() {
        fillsApplied.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                ordersDetected.get(),
                ordersMirrored.get(),
                ordersQueued.get(),
                ordersRejected.get(),
                ordersCanceled.get(),
                fillsApplied.get());
    }

    /**
     * @param ordersDetected source orders seen on the feed
     * @param ordersMirrored mirror orders the venue accepted, first try or after retry
     * @param ordersQueued submissions that went to the retry queue
     * @param ordersRejected source orders not mirrored (sizing, risk, venue or circuit)
     * @param ordersCanceled mirror orders confirmed CANCELED, by the venue or locally while still queued
     */
    public record Snapshot(
            long ordersDetected,
            long ordersMirrored,
            long ordersQueued,
            long ordersRejected,
            long ordersCanceled,
            long fillsApplied) {}
}
