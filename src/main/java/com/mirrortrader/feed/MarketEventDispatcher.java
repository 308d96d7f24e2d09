package com.mirrortrader.feed;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes raw feed events onto one single-threaded worker per market.
 *
 * <p>Events of one market are handled strictly in arrival order; different markets run in
 * parallel. Workers are created lazily on the first event for a market and are daemon
 * threads, so a stuck worker never blocks JVM exit.
 */
@Component
public class MarketEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MarketEventDispatcher.class);

    private static final String NO_MARKET = "_none";

    private final FeedEventHandler handler;
    private final Map<String, ExecutorService> workers = new ConcurrentHashMap<>();
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public MarketEventDispatcher(FeedEventHandler handler) {
        this.handler = handler;
    }

    /**
     * Queues an event on its market's worker.
     *
     * @return completes once the handler has processed the event; completed exceptionally
     *     if the dispatcher has been shut down
     */
    public CompletableFuture<Void> dispatch(RawFeedEvent rawEvent) {
        if (!accepting.get()) {
            return CompletableFuture.failedFuture(
                    new RejectedExecutionException("Dispatcher is shut down, event dropped: " + rawEvent.eventType()));
        }
        String market = partition(rawEvent.market());
        ExecutorService worker = workers.computeIfAbsent(market, this::newWorker);
        try {
            return CompletableFuture.runAsync(() -> handleSafely(rawEvent), worker);
        } catch (RejectedExecutionException e) {
            log.warn("Worker for market={} rejected event type={}", market, rawEvent.eventType());
            return CompletableFuture.failedFuture(e);
        }
    }

    public int getWorkerCount() {
        return workers.size();
    }

    /** Stops accepting events and waits up to the timeout for queued events to drain. */
    public void shutdown(Duration timeout) {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        List<ExecutorService> executors = List.copyOf(workers.values());
        executors.forEach(ExecutorService::shutdown);
        long deadline = System.nanoTime() + timeout.toNanos();
        for (ExecutorService executor : executors) {
            try {
                long remaining = deadline - System.nanoTime();
                if (!executor.awaitTermination(Math.max(remaining, 0), TimeUnit.NANOSECONDS)) {
                    List<Runnable> dropped = executor.shutdownNow();
                    log.warn("Market worker did not drain in time, {} queued events dropped", dropped.size());
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("MarketEventDispatcher stopped: workers={}", executors.size());
    }

    private void handleSafely(RawFeedEvent rawEvent) {
        try {
            handler.handle(rawEvent);
        } catch (RuntimeException e) {
            log.error(
                    "Event handler failed: market={}, type={}, payload={}",
                    rawEvent.market(),
                    rawEvent.eventType(),
                    rawEvent.payload(),
                    e);
        }
    }

    private ExecutorService newWorker(String market) {
        log.info("Starting event worker for market={}", market);
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "market-" + abbreviate(market));
            thread.setDaemon(true);
            return thread;
        });
    }

    private static String partition(String market) {
        return market != null && !market.isBlank() ? market.toLowerCase(Locale.ROOT) : NO_MARKET;
    }

    private static String abbreviate(String market) {
        return market.length() > 12 ? market.substring(0, 12) : market;
    }
}
