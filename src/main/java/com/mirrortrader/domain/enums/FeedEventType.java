package com.mirrortrader.domain.enums;

/** Canonical feed event kinds produced by the normalizer. */
public enum FeedEventType {
    ORDER_OPENED,
    FILLED,
    ORDERS_CLOSED
}
