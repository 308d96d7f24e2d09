package com.mirrortrader.unit.retry;

import static org.assertj.core.api.Assertions.assertThat;

import com.mirrortrader.domain.enums.CircuitState;
import com.mirrortrader.retry.CircuitBreaker;
import com.mirrortrader.unit.support.MutableClock;
import com.mirrortrader.unit.support.TestMirrorConfig;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CircuitBreaker: 10 failures within 60s open it, a 300s cool-down leads to a
 * single HALF_OPEN trial, and the trial result closes or re-opens it.
 */
class CircuitBreakerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        circuitBreaker = new CircuitBreaker(TestMirrorConfig.defaults(), clock);
    }

    // ==============================
    // TRIPPING
    // ==============================

    @Nested
    @DisplayName("Tripping")
    class Tripping {

        @Test
        @DisplayName("Nine failures keep it CLOSED, the tenth within 60s opens it")
        void tenFailuresInWindow_opens() {
            failTimes(9);
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(circuitBreaker.getRecentFailureCount()).isEqualTo(9);

            circuitBreaker.onFailure();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
            assertThat(circuitBreaker.getTripCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Failures older than the window no longer count")
        void failuresOutsideWindow_expire() {
            failTimes(9);
            clock.advance(Duration.ofSeconds(61));

            circuitBreaker.onFailure();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(circuitBreaker.getRecentFailureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Successes while CLOSED do not reset the failure count")
        void successWhileClosed_keepsCount() {
            failTimes(5);
            circuitBreaker.onSuccess();

            assertThat(circuitBreaker.getRecentFailureCount()).isEqualTo(5);
        }
    }

    // ==============================
    // RECOVERY
    // ==============================

    @Nested
    @DisplayName("Recovery")
    class Recovery {

        @BeforeEach
        void trip() {
            failTimes(10);
        }

        @Test
        @DisplayName("Stays OPEN until the cool-down has elapsed")
        void beforeCoolDown_denies() {
            clock.advance(Duration.ofSeconds(299));

            assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
        }

        @Test
        @DisplayName("After the cool-down exactly one trial is let through")
        void afterCoolDown_singleTrial() {
            clock.advance(Duration.ofSeconds(300));

            assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
        }

        @Test
        @DisplayName("HALF_OPEN trial success closes the breaker")
        void trialSuccess_closes() {
            clock.advance(Duration.ofSeconds(300));
            circuitBreaker.tryAcquirePermission();

            circuitBreaker.onSuccess();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
            assertThat(circuitBreaker.getRecentFailureCount()).isZero();
        }

        @Test
        @DisplayName("HALF_OPEN trial failure re-opens with a fresh cool-down")
        void trialFailure_reopens() {
            clock.advance(Duration.ofSeconds(300));
            circuitBreaker.tryAcquirePermission();

            circuitBreaker.onFailure();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(circuitBreaker.getTripCount()).isEqualTo(2);
            clock.advance(Duration.ofSeconds(299));
            assertThat(circuitBreaker.tryAcquirePermission()).isFalse();
            clock.advance(Duration.ofSeconds(1));
            assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
        }

        @Test
        @DisplayName("Released trial slot can be claimed again")
        void releasePermission_freesTrial() {
            clock.advance(Duration.ofSeconds(300));
            circuitBreaker.tryAcquirePermission();

            circuitBreaker.releasePermission();

            assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
        }

        @Test
        @DisplayName("Late failures while OPEN do not extend the cool-down")
        void failureWhileOpen_doesNotExtend() {
            clock.advance(Duration.ofSeconds(200));
            circuitBreaker.onFailure();
            clock.advance(Duration.ofSeconds(100));

            assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
        }
    }

    private void failTimes(int count) {
        for (int i = 0; i < count; i++) {
            clock.advance(Duration.ofSeconds(1));
            circuitBreaker.onFailure();
        }
    }
}
