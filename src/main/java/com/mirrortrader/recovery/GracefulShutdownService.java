package com.mirrortrader.recovery;

import com.mirrortrader.core.engine.MirrorEngine;
import com.mirrortrader.feed.MarketEventDispatcher;
import com.mirrortrader.retry.RetryItem;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Ensures an orderly stop of the mirror pipeline.
 *
 * <p>Implements {@link SmartLifecycle} with a high phase so it runs before the rest of the
 * context shuts down. The sequence:
 * <ol>
 *   <li>Drain the per-market workers (bounded wait) so queued events finish</li>
 *   <li>Stop the engine: no new events, retry queue frozen and reported</li>
 * </ol>
 *
 * <p>Queued retries are NOT submitted on the way out. Placing orders during an uncertain
 * shutdown could leave positions nobody is watching.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private final MarketEventDispatcher dispatcher;
    private final MirrorEngine mirrorEngine;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(MarketEventDispatcher dispatcher, MirrorEngine mirrorEngine) {
        this.dispatcher = dispatcher;
        this.mirrorEngine = mirrorEngine;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            dispatcher.shutdown(DRAIN_TIMEOUT);
            List<RetryItem> unsent = mirrorEngine.shutdown();
            log.info(
                    "Graceful shutdown completed: unsentRetries={}, stats={}",
                    unsent.size(),
                    mirrorEngine.getStatistics());
        } catch (RuntimeException e) {
            log.error("Error during graceful shutdown", e);
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Stops right after the feed subscription and before other Spring components
        return Integer.MAX_VALUE - 1;
    }
}
