package com.mirrortrader.retry;

import com.mirrortrader.config.MirrorConfig;
import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Exponential retry delays: {@code baseDelay x multiplier^attempt}, capped at maxDelay.
 *
 * <p>Attempts are zero-based here (the first retry is attempt 0), while resilience4j's
 * {@link IntervalFunction} numbers attempts from one.
 */
@Component
public class BackoffPolicy {

    private final IntervalFunction intervalFunction;

    public BackoffPolicy(MirrorConfig mirrorConfig) {
        MirrorConfig.Retry retry = mirrorConfig.getRetry();
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(
                retry.getBaseDelay().toMillis(), retry.getBackoffMultiplier(), retry.getMaxDelay().toMillis());
    }

    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, was " + attempt);
        }
        return Duration.ofMillis(intervalFunction.apply(attempt + 1));
    }
}
