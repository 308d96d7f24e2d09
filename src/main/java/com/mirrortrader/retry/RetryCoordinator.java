package com.mirrortrader.retry;

import com.mirrortrader.broker.ExecutionClient;
import com.mirrortrader.config.MirrorConfig;
import com.mirrortrader.domain.enums.CircuitState;
import com.mirrortrader.domain.model.MirrorAction;
import com.mirrortrader.exception.SubmissionException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Submits mirror orders to the venue and owns what happens when a submission fails.
 *
 * <p>Flow for {@link #submit}:
 * <ol>
 *   <li>Fail fast with CIRCUIT_OPEN if the {@link CircuitBreaker} denies permission</li>
 *   <li>Call the venue; success is ACCEPTED</li>
 *   <li>Permanent failures are REJECTED and never retried</li>
 *   <li>Retriable failures are QUEUED with {@code nextRetryAt = now + backoff(attempt)}</li>
 * </ol>
 *
 * <p>A scheduled poll re-dispatches due items. Retries of one clientOrderId are serialized:
 * a second attempt is never started while one is in flight. Right before each dispatch the
 * coordinator checks the action is still wanted, so an action {@link #withdraw withdrawn}
 * because its source order was canceled is dropped instead of placed. An item that has used
 * up its retries, or meets a permanent failure on retry, goes to the {@link DeadLetterLog}.
 * Queue exits are announced with a {@link RetryOutcomeEvent}.
 */
@Service
public class RetryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RetryCoordinator.class);

    private final ExecutionClient executionClient;
    private final CircuitBreaker circuitBreaker;
    private final BackoffPolicy backoffPolicy;
    private final SubmissionErrorClassifier errorClassifier;
    private final DeadLetterLog deadLetterLog;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int maxAttempts;

    /** clientOrderId -> queued item. */
    private final Map<String, RetryItem> queue = new ConcurrentHashMap<>();

    /** Actions queued or in flight that have not been withdrawn. */
    private final Set<String> wanted = ConcurrentHashMap.newKeySet();

    /** Actions with a venue call in progress. */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicLong retryAttempts = new AtomicLong();

    public RetryCoordinator(
            ExecutionClient executionClient,
            CircuitBreaker circuitBreaker,
            BackoffPolicy backoffPolicy,
            SubmissionErrorClassifier errorClassifier,
            DeadLetterLog deadLetterLog,
            ApplicationEventPublisher eventPublisher,
            MirrorConfig mirrorConfig,
            Clock clock) {
        this.executionClient = executionClient;
        this.circuitBreaker = circuitBreaker;
        this.backoffPolicy = backoffPolicy;
        this.errorClassifier = errorClassifier;
        this.deadLetterLog = deadLetterLog;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.maxAttempts = mirrorConfig.getRetry().getMaxAttempts();
    }

    // ==================== Submission ====================

    public SubmissionResult submit(MirrorAction action) {
        String clientOrderId = action.getClientOrderId();
        if (!accepting.get()) {
            return SubmissionResult.rejected("shutting down: submission not attempted");
        }
        if (queue.containsKey(clientOrderId) || !inFlight.add(clientOrderId)) {
            return SubmissionResult.rejected("submission already pending for clientOrderId=" + clientOrderId);
        }
        try {
            if (!circuitBreaker.tryAcquirePermission()) {
                log.warn("Circuit open, submission refused: clientOrderId={}, market={}", clientOrderId, action.getMarket());
                return SubmissionResult.circuitOpen();
            }
            wanted.add(clientOrderId);
            return firstAttempt(action);
        } finally {
            inFlight.remove(clientOrderId);
        }
    }

    private SubmissionResult firstAttempt(MirrorAction action) {
        String clientOrderId = action.getClientOrderId();
        try {
            long orderId = dispatch(action);
            circuitBreaker.onSuccess();
            wanted.remove(clientOrderId);
            log.info("Submission accepted: clientOrderId={}, orderId={}", clientOrderId, orderId);
            return SubmissionResult.accepted(orderId);
        } catch (SubmissionException e) {
            if (errorClassifier.classify(e) == FailureClass.PERMANENT) {
                circuitBreaker.onSuccess();
                wanted.remove(clientOrderId);
                log.warn("Submission rejected permanently: clientOrderId={}, error={}", clientOrderId, e.describe());
                return SubmissionResult.rejected("venue rejected order: " + e.describe());
            }
            circuitBreaker.onFailure();
            if (maxAttempts == 0) {
                wanted.remove(clientOrderId);
                deadLetter(action, 1, e.describe());
                return SubmissionResult.rejected("submission failed and retries are disabled: " + e.describe());
            }
            RetryItem item = schedule(action, 0, e);
            log.warn(
                    "Submission failed, queued for retry: clientOrderId={}, error={}, nextRetryAt={}",
                    clientOrderId,
                    e.describe(),
                    item.nextRetryAt());
            return SubmissionResult.queued("retrying after " + e.describe());
        } catch (RuntimeException e) {
            circuitBreaker.onFailure();
            wanted.remove(clientOrderId);
            throw e;
        }
    }

    // ==================== Retry Processing ====================

    /** Re-dispatches every due item. Returns the number of venue calls made. */
    @Scheduled(fixedDelayString = "${mirror.retry.poll-interval-ms:500}")
    public int processDueRetries() {
        if (!accepting.get() || queue.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        List<RetryItem> due = queue.values().stream()
                .filter(item -> item.isDue(now))
                .sorted(Comparator.comparing(RetryItem::nextRetryAt))
                .toList();

        int dispatched = 0;
        for (RetryItem item : due) {
            if (!accepting.get()) {
                break;
            }
            if (retry(item)) {
                dispatched++;
            }
        }
        return dispatched;
    }

    private boolean retry(RetryItem item) {
        String clientOrderId = item.clientOrderId();
        if (!inFlight.add(clientOrderId)) {
            return false;
        }
        try {
            if (queue.get(clientOrderId) != item) {
                return false;
            }
            if (!circuitBreaker.tryAcquirePermission()) {
                log.debug("Retry deferred, circuit open: clientOrderId={}", clientOrderId);
                return false;
            }
            if (!wanted.contains(clientOrderId)) {
                circuitBreaker.releasePermission();
                queue.remove(clientOrderId, item);
                log.info("Retry dropped, action withdrawn: clientOrderId={}", clientOrderId);
                return false;
            }

            retryAttempts.incrementAndGet();
            MirrorAction action = item.action();
            try {
                long orderId = dispatch(action);
                circuitBreaker.onSuccess();
                queue.remove(clientOrderId, item);
                wanted.remove(clientOrderId);
                log.info(
                        "Retry accepted: clientOrderId={}, orderId={}, retry={}",
                        clientOrderId,
                        orderId,
                        item.attemptCount() + 1);
                eventPublisher.publishEvent(RetryOutcomeEvent.accepted(this, action, orderId));
            } catch (SubmissionException e) {
                handleRetryFailure(item, e);
            } catch (RuntimeException e) {
                circuitBreaker.onFailure();
                throw e;
            }
            return true;
        } finally {
            inFlight.remove(clientOrderId);
        }
    }

    private void handleRetryFailure(RetryItem item, SubmissionException e) {
        String clientOrderId = item.clientOrderId();
        int retriesMade = item.attemptCount() + 1;
        if (errorClassifier.classify(e) == FailureClass.PERMANENT) {
            circuitBreaker.onSuccess();
            finish(item);
            deadLetter(item.action(), retriesMade + 1, e.describe());
            return;
        }

        circuitBreaker.onFailure();
        if (!wanted.contains(clientOrderId)) {
            queue.remove(clientOrderId, item);
            log.info("Retry failed after withdrawal, dropping: clientOrderId={}", clientOrderId);
        } else if (retriesMade >= maxAttempts) {
            finish(item);
            deadLetter(item.action(), retriesMade + 1, e.describe());
        } else {
            RetryItem next = schedule(item.action(), retriesMade, e);
            log.warn(
                    "Retry {} failed: clientOrderId={}, error={}, nextRetryAt={}",
                    retriesMade,
                    clientOrderId,
                    e.describe(),
                    next.nextRetryAt());
        }
    }

    // ==================== Withdrawal & Shutdown ====================

    /**
     * Marks an action as no longer wanted. A queued item is removed; an in-flight attempt is
     * not recalled, but it will not be retried if it fails.
     *
     * @return true if the action was queued or in flight
     */
    public boolean withdraw(String clientOrderId) {
        boolean wasWanted = wanted.remove(clientOrderId);
        RetryItem removed = queue.remove(clientOrderId);
        if (wasWanted || removed != null) {
            log.info("Action withdrawn: clientOrderId={}, wasQueued={}", clientOrderId, removed != null);
            return true;
        }
        return false;
    }

    /**
     * Stops accepting submissions and retries and returns what is still queued. Nothing is
     * submitted on the way out.
     */
    public List<RetryItem> shutdown() {
        accepting.set(false);
        List<RetryItem> remaining = pendingItems();
        log.info("RetryCoordinator stopped with {} queued items", remaining.size());
        for (RetryItem item : remaining) {
            log.info(
                    "Unsent at shutdown: clientOrderId={}, market={}, attempts={}, lastError={}, nextRetryAt={}",
                    item.clientOrderId(),
                    item.action().getMarket(),
                    item.attemptCount(),
                    item.lastError(),
                    item.nextRetryAt());
        }
        return remaining;
    }

    // ==================== Queries ====================

    public boolean isPending(String clientOrderId) {
        return queue.containsKey(clientOrderId) || inFlight.contains(clientOrderId);
    }

    public List<RetryItem> pendingItems() {
        return queue.values().stream()
                .sorted(Comparator.comparing(RetryItem::nextRetryAt))
                .toList();
    }

    public int getQueueDepth() {
        return queue.size();
    }

    public long getRetryAttempts() {
        return retryAttempts.get();
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    public CircuitState getCircuitState() {
        return circuitBreaker.getState();
    }

    // ==================== Internals ====================

    private long dispatch(MirrorAction action) {
        return executionClient.submitOrder(
                action.getMarket(), action.getSide(), action.getPrice(), action.getSize(), action.getClientOrderId());
    }

    private RetryItem schedule(MirrorAction action, int attemptCount, SubmissionException e) {
        Duration delay = backoffPolicy.delayFor(attemptCount);
        RetryItem item = new RetryItem(
                action, attemptCount, clock.instant().plus(delay), e.getKind(), e.describe(), FailureClass.RETRIABLE);
        queue.put(action.getClientOrderId(), item);
        return item;
    }

    private void finish(RetryItem item) {
        queue.remove(item.clientOrderId(), item);
        wanted.remove(item.clientOrderId());
    }

    private void deadLetter(MirrorAction action, int attempts, String lastError) {
        DeadLetterRecord record = new DeadLetterRecord(action, attempts, lastError, clock.instant());
        deadLetterLog.record(record);
        eventPublisher.publishEvent(RetryOutcomeEvent.deadLettered(this, record));
    }
}
