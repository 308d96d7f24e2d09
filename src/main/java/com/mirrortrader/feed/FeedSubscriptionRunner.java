package com.mirrortrader.feed;

import com.mirrortrader.config.MirrorConfig;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Connects the configured {@link FeedSource}, if any, to the {@link MarketEventDispatcher}
 * for the subscribed markets on startup, and closes it on shutdown.
 *
 * <p>Without a FeedSource bean, events can still be injected through the REST endpoint.
 */
@Component
public class FeedSubscriptionRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(FeedSubscriptionRunner.class);

    private final ObjectProvider<FeedSource> feedSourceProvider;
    private final MarketEventDispatcher dispatcher;
    private final MirrorConfig mirrorConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private FeedSource feedSource;

    public FeedSubscriptionRunner(
            ObjectProvider<FeedSource> feedSourceProvider, MarketEventDispatcher dispatcher, MirrorConfig mirrorConfig) {
        this.feedSourceProvider = feedSourceProvider;
        this.dispatcher = dispatcher;
        this.mirrorConfig = mirrorConfig;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        feedSource = feedSourceProvider.getIfAvailable();
        if (feedSource == null) {
            log.info("No FeedSource configured; events accepted via REST only");
            return;
        }
        feedSource.subscribe(mirrorConfig.getMarkets(), dispatcher::dispatch);
        log.info("Subscribed to feed: markets={}", mirrorConfig.getMarkets());
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false) && feedSource != null) {
            feedSource.close();
            log.info("Feed subscription closed");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Stops before GracefulShutdownService so no new events arrive while the engine drains
        return Integer.MAX_VALUE;
    }
}
