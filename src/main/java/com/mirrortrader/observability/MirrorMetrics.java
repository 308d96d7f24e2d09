package com.mirrortrader.observability;

import com.mirrortrader.domain.enums.FeedEventType;
import com.mirrortrader.oms.FillOutcome;
import com.mirrortrader.position.PositionTracker;
import com.mirrortrader.retry.CircuitBreaker;
import com.mirrortrader.retry.RetryCoordinator;
import com.mirrortrader.retry.SubmissionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the mirror engine.
 *
 * <ul>
 *   <li><b>mirror.events.normalization.failures</b> (counter): malformed payloads dropped</li>
 *   <li><b>mirror.events.filtered</b> (counter): well-formed events outside our interest</li>
 *   <li><b>mirror.events.errors</b> (counter, tag kind): handler failures caught by the event loop</li>
 *   <li><b>mirror.submissions</b> (counter, tag status): submission outcomes</li>
 *   <li><b>mirror.risk.rejections</b> (counter, tag code): actions refused by risk checks</li>
 *   <li><b>mirror.fills</b> (counter, tag outcome): fill outcomes from the order tracker</li>
 *   <li><b>mirror.fills.capped</b> (counter): fills that overran their order size</li>
 *   <li><b>mirror.dead.letters</b> (counter)</li>
 *   <li><b>mirror.cancel.failures</b> (counter): venue cancel calls that failed</li>
 *   <li><b>mirror.circuit.trips</b> (function counter), <b>mirror.circuit.state</b> (gauge 0/1/2)</li>
 *   <li><b>mirror.exposure.total</b>, <b>mirror.retry.queue.depth</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are read lazily at scrape time from the owning components.
 */
@Service
public class MirrorMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter normalizationFailures;
    private final Counter filteredEvents;
    private final Counter cappedFills;
    private final Counter deadLetters;
    private final Counter cancelFailures;
    private final Map<SubmissionResult.Status, Counter> submissions = new EnumMap<>(SubmissionResult.Status.class);
    private final Map<FillOutcome.Kind, Counter> fills = new EnumMap<>(FillOutcome.Kind.class);
    private final Map<FeedEventType, Counter> handlerErrors = new EnumMap<>(FeedEventType.class);

    public MirrorMetrics(
            MeterRegistry meterRegistry,
            PositionTracker positionTracker,
            RetryCoordinator retryCoordinator,
            CircuitBreaker circuitBreaker) {
        this.meterRegistry = meterRegistry;

        this.normalizationFailures = Counter.builder("mirror.events.normalization.failures")
                .description("Malformed feed payloads dropped by the normalizer")
                .register(meterRegistry);
        this.filteredEvents = Counter.builder("mirror.events.filtered")
                .description("Well-formed events for unsubscribed markets or unrelated wallets")
                .register(meterRegistry);
        this.cappedFills = Counter.builder("mirror.fills.capped")
                .description("Fills larger than the remaining order size")
                .register(meterRegistry);
        this.deadLetters = Counter.builder("mirror.dead.letters")
                .description("Submissions given up on")
                .register(meterRegistry);
        this.cancelFailures = Counter.builder("mirror.cancel.failures")
                .description("Venue cancel calls that failed")
                .register(meterRegistry);

        for (SubmissionResult.Status status : SubmissionResult.Status.values()) {
            submissions.put(status, Counter.builder("mirror.submissions")
                    .tag("status", status.name())
                    .register(meterRegistry));
        }
        for (FillOutcome.Kind kind : FillOutcome.Kind.values()) {
            fills.put(kind, Counter.builder("mirror.fills")
                    .tag("outcome", kind.name())
                    .register(meterRegistry));
        }
        for (FeedEventType type : FeedEventType.values()) {
            handlerErrors.put(type, Counter.builder("mirror.events.errors")
                    .tag("kind", type.name())
                    .register(meterRegistry));
        }

        FunctionCounter.builder("mirror.circuit.trips", circuitBreaker, CircuitBreaker::getTripCount)
                .description("Times the submission circuit breaker opened")
                .register(meterRegistry);
        Gauge.builder("mirror.circuit.state", circuitBreaker, breaker -> breaker.getState().gaugeValue())
                .description("Circuit breaker state: 0 closed, 1 half-open, 2 open")
                .register(meterRegistry);
        Gauge.builder("mirror.exposure.total", positionTracker, tracker -> tracker.totalExposure().doubleValue())
                .description("Sum of |size| x last price across markets")
                .register(meterRegistry);
        Gauge.builder("mirror.retry.queue.depth", retryCoordinator, RetryCoordinator::getQueueDepth)
                .description("Submissions waiting for retry")
                .register(meterRegistry);
    }

    public void recordNormalizationFailure() {
        normalizationFailures.increment();
    }

    public void recordFilteredEvent() {
        filteredEvents.increment();
    }

    public void recordHandlerError(FeedEventType type) {
        handlerErrors.get(type).increment();
    }

    public void recordSubmission(SubmissionResult.Status status) {
        submissions.get(status).increment();
    }

    public void recordRiskRejection(String code) {
        meterRegistry.counter("mirror.risk.rejections", "code", code).increment();
    }

    public void recordFill(FillOutcome outcome) {
        fills.get(outcome.kind()).increment();
        if (outcome.capped()) {
            cappedFills.increment();
        }
    }

    public void recordDeadLetter() {
        deadLetters.increment();
    }

    public void recordCancelFailure() {
        cancelFailures.increment();
    }
}
