package com.mirrortrader.config;

import com.mirrortrader.broker.BalanceSource;
import com.mirrortrader.broker.ExecutionClient;
import com.mirrortrader.broker.PaperExecutionClient;
import com.mirrortrader.broker.StaticBalanceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Falls back to paper trading when no venue binding is on the context.
 *
 * <p>A live deployment supplies its own {@link ExecutionClient} and {@link BalanceSource}
 * beans; startup refuses to fall back to paper trading unless {@code mirror.dry-run} is set.
 */
@Configuration
public class BrokerConfig {

    private static final Logger log = LoggerFactory.getLogger(BrokerConfig.class);

    @Bean
    @ConditionalOnMissingBean(ExecutionClient.class)
    public ExecutionClient paperExecutionClient(MirrorConfig mirrorConfig) {
        requireDryRun(mirrorConfig, "ExecutionClient");
        log.info("Using paper execution client (dry run)");
        return new PaperExecutionClient();
    }

    @Bean
    @ConditionalOnMissingBean(BalanceSource.class)
    public BalanceSource staticBalanceSource(MirrorConfig mirrorConfig) {
        requireDryRun(mirrorConfig, "BalanceSource");
        log.info("Using static paper balance: {}", mirrorConfig.getPaperBalance().toPlainString());
        return new StaticBalanceSource(mirrorConfig.getPaperBalance());
    }

    private static void requireDryRun(MirrorConfig mirrorConfig, String missing) {
        if (!mirrorConfig.isDryRun()) {
            throw new IllegalStateException(
                    "No " + missing + " bean configured and mirror.dry-run is false; refusing to start");
        }
    }
}
