package com.mirrortrader.retry;

import com.mirrortrader.config.MirrorConfig;
import com.mirrortrader.domain.enums.CircuitState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide fail-fast guard for venue submissions.
 *
 * <p>Counts retriable failures in a rolling time window. Reaching the threshold opens the
 * breaker; while OPEN no submission may reach the venue. Once the cool-down has elapsed the
 * next permission request moves it to HALF_OPEN and lets exactly one trial through:
 * success closes it, failure re-opens it with a fresh cool-down.
 *
 * <p>This is the only state shared across markets, so every method is synchronized.
 */
@Component
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final Clock clock;
    private final int failureThreshold;
    private final Duration window;
    private final Duration coolDown;

    private final Deque<Instant> failures = new ArrayDeque<>();
    private CircuitState state = CircuitState.CLOSED;
    private Instant openedAt;
    private boolean trialInFlight;
    private long tripCount;

    public CircuitBreaker(MirrorConfig mirrorConfig, Clock clock) {
        this.clock = clock;
        this.failureThreshold = mirrorConfig.getCircuit().getFailureThreshold();
        this.window = mirrorConfig.getCircuit().getWindow();
        this.coolDown = mirrorConfig.getCircuit().getCoolDown();
    }

    /**
     * Asks whether a submission may reach the venue now. A true answer in HALF_OPEN claims
     * the single trial slot; the caller must report its result.
     */
    public synchronized boolean tryAcquirePermission() {
        if (state == CircuitState.CLOSED) {
            return true;
        }
        if (state == CircuitState.OPEN) {
            if (clock.instant().isBefore(openedAt.plus(coolDown))) {
                return false;
            }
            transitionTo(CircuitState.HALF_OPEN);
        } else if (trialInFlight) {
            return false;
        }
        trialInFlight = true;
        return true;
    }

    /** The venue answered. A rejection of the order itself still counts: the venue is reachable. */
    public synchronized void onSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            failures.clear();
            trialInFlight = false;
            transitionTo(CircuitState.CLOSED);
        }
    }

    /** A retriable failure: the venue could not be reached or was too busy to answer. */
    public synchronized void onFailure() {
        Instant now = clock.instant();
        switch (state) {
            case HALF_OPEN -> {
                trialInFlight = false;
                trip(now);
            }
            case CLOSED -> {
                failures.addLast(now);
                evictOutsideWindow(now);
                if (failures.size() >= failureThreshold) {
                    trip(now);
                }
            }
            case OPEN -> {
                // Calls already in flight when the breaker opened; the cool-down is not extended
            }
        }
    }

    /** Releases an unused HALF_OPEN trial slot, e.g. when the action was withdrawn before dispatch. */
    public synchronized void releasePermission() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    /** Failures currently counted in the rolling window. */
    public synchronized int getRecentFailureCount() {
        evictOutsideWindow(clock.instant());
        return failures.size();
    }

    public synchronized long getTripCount() {
        return tripCount;
    }

    private void trip(Instant now) {
        openedAt = now;
        failures.clear();
        tripCount++;
        transitionTo(CircuitState.OPEN);
    }

    private void evictOutsideWindow(Instant now) {
        Instant cutoff = now.minus(window);
        while (!failures.isEmpty() && !failures.peekFirst().isAfter(cutoff)) {
            failures.pollFirst();
        }
    }

    private void transitionTo(CircuitState next) {
        if (state != next) {
            log.warn("Circuit breaker {} -> {} (threshold={}, window={}, coolDown={})",
                    state, next, failureThreshold, window, coolDown);
            state = next;
        }
    }
}
