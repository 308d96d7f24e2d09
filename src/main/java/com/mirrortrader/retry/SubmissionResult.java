package com.mirrortrader.retry;

/**
 * Immediate answer to {@link RetryCoordinator#submit}.
 *
 * <ul>
 *   <li>ACCEPTED: the venue took the order; orderId is set</li>
 *   <li>QUEUED: a retriable failure; the action waits in the retry queue</li>
 *   <li>REJECTED: a permanent failure, never retried</li>
 *   <li>CIRCUIT_OPEN: failed fast without contacting the venue</li>
 * </ul>
 */
public record SubmissionResult(Status status, Long orderId, String reason) {

    public enum Status {
        ACCEPTED,
        QUEUED,
        REJECTED,
        CIRCUIT_OPEN
    }

    public static SubmissionResult accepted(long orderId) {
        return new SubmissionResult(Status.ACCEPTED, orderId, null);
    }

    public static SubmissionResult queued(String reason) {
        return new SubmissionResult(Status.QUEUED, null, reason);
    }

    public static SubmissionResult rejected(String reason) {
        return new SubmissionResult(Status.REJECTED, null, reason);
    }

    public static SubmissionResult circuitOpen() {
        return new SubmissionResult(Status.CIRCUIT_OPEN, null, "circuit open: venue submissions suspended");
    }
}
