package com.mirrortrader.domain.enums;

/** How an execution venue call failed. */
public enum SubmissionErrorKind {
    NETWORK,
    TIMEOUT,
    REJECTED
}
