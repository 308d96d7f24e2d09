package com.mirrortrader.retry;

import com.mirrortrader.domain.enums.SubmissionErrorKind;
import com.mirrortrader.domain.model.MirrorAction;
import java.time.Instant;

/**
 * A failed submission waiting in the retry queue.
 *
 * @param attemptCount retries already made; the initial submission is not counted
 * @param failureClass classification of the last failure; only RETRIABLE items are queued
 */
public record RetryItem(
        MirrorAction action,
        int attemptCount,
        Instant nextRetryAt,
        SubmissionErrorKind lastErrorKind,
        String lastError,
        FailureClass failureClass) {

    public String clientOrderId() {
        return action.getClientOrderId();
    }

    public boolean isDue(Instant now) {
        return !nextRetryAt.isAfter(now);
    }
}
