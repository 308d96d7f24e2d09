package com.mirrortrader.retry;

/** Whether a failed submission is worth trying again. */
public enum FailureClass {
    RETRIABLE,
    PERMANENT
}
