package com.mirrortrader.oms;

/** Result of a cancel request against the {@link OrderTracker}. */
public enum CancelOutcome {
    CANCELED,
    ALREADY_TERMINAL,
    UNKNOWN_ORDER,

    /** The order already reached the venue and must be canceled there. */
    NOT_PENDING
}
