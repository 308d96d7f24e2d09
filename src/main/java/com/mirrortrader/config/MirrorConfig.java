package com.mirrortrader.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the mirror engine, bound from {@code mirror.*}.
 *
 * <p>Wallet and market identifiers are lower-cased on bind so comparisons against feed
 * payloads are case-insensitive. Risk limits are bound separately by {@link RiskConfig}.
 */
@Configuration
@ConfigurationProperties(prefix = "mirror")
@Validated
@Getter
@Setter
public class MirrorConfig {

    /** Wallets whose order activity is mirrored. */
    @NotEmpty
    private Set<String> sourceWallets = new LinkedHashSet<>();

    /** Our own trading wallet; cancel events for it confirm cancellation of mirror orders. */
    private String ownWallet;

    /** Subscription set. Events for any other market are dropped. */
    @NotEmpty
    private Set<String> markets = new LinkedHashSet<>();

    /** Subscribed markets whose new source orders are never mirrored. */
    private Set<String> marketBlacklist = new LinkedHashSet<>();

    /** Mirror size = source size x copyRatio. */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal copyRatio = BigDecimal.ONE;

    /** Lot size the mirror size is rounded down to. Null disables rounding. */
    private BigDecimal sizeIncrement;

    /** Collateral asset whose balance backs new exposure. */
    @NotBlank
    private String collateralAsset = "USDC";

    /** Per-market collateral asset overrides, keyed by market. */
    private Map<String, String> quoteAssets = new HashMap<>();

    /** Fraction of notional required as margin. Null means full notional. */
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal marginRequirement;

    /** Use the paper execution client and static balance when no venue client is configured. */
    private boolean dryRun = true;

    /** Balance reported by the paper balance source for every asset. */
    private BigDecimal paperBalance = BigDecimal.valueOf(10_000);

    /** Optional append-only JSON-lines file for dead-letter records. */
    private String deadLetterFile;

    @Valid
    private Tracker tracker = new Tracker();

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Circuit circuit = new Circuit();

    public void setSourceWallets(Set<String> sourceWallets) {
        this.sourceWallets = lowerCase(sourceWallets);
    }

    public void setMarkets(Set<String> markets) {
        this.markets = lowerCase(markets);
    }

    public void setMarketBlacklist(Set<String> marketBlacklist) {
        this.marketBlacklist = lowerCase(marketBlacklist);
    }

    public void setOwnWallet(String ownWallet) {
        this.ownWallet = ownWallet != null ? ownWallet.toLowerCase(Locale.ROOT) : null;
    }

    public void setQuoteAssets(Map<String, String> quoteAssets) {
        Map<String, String> normalized = new HashMap<>();
        quoteAssets.forEach((market, asset) -> normalized.put(market.toLowerCase(Locale.ROOT), asset));
        this.quoteAssets = normalized;
    }

    public boolean isSourceWallet(String wallet) {
        return wallet != null && sourceWallets.contains(wallet.toLowerCase(Locale.ROOT));
    }

    public boolean isOwnWallet(String wallet) {
        return wallet != null && ownWallet != null && ownWallet.equalsIgnoreCase(wallet);
    }

    public boolean isSubscribed(String market) {
        return market != null && markets.contains(market.toLowerCase(Locale.ROOT));
    }

    public boolean isBlacklisted(String market) {
        return market != null && marketBlacklist.contains(market.toLowerCase(Locale.ROOT));
    }

    public String collateralAssetFor(String market) {
        return quoteAssets.getOrDefault(market, collateralAsset);
    }

    private static Set<String> lowerCase(Set<String> values) {
        return values.stream()
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Getter
    @Setter
    public static class Tracker {

        /** Capacity of the recent-fills window used to drop replayed fills. */
        @Min(1)
        private int recentFillCapacity = 10_000;

        /** How long terminal orders are kept before eviction. */
        @NotNull
        private Duration terminalTtl = Duration.ofHours(1);

        /** Interval between terminal-order eviction sweeps, in milliseconds. */
        private long evictionIntervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class Retry {

        /** Retries allowed after the initial submission before an action is dead-lettered. */
        @Min(0)
        private int maxAttempts = 3;

        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        @NotNull
        private Duration maxDelay = Duration.ofMinutes(5);

        /** How often the retry queue is polled for due items, in milliseconds. */
        private long pollIntervalMs = 500;

        /** Venue rejection codes that indicate transient congestion rather than a bad order. */
        private Set<String> retriableRejectCodes =
                new LinkedHashSet<>(Set.of("VENUE_BUSY", "CONGESTION", "RATE_LIMITED"));
    }

    @Getter
    @Setter
    public static class Circuit {

        /** Retriable failures within the window that open the breaker. */
        @Min(1)
        private int failureThreshold = 10;

        @NotNull
        private Duration window = Duration.ofSeconds(60);

        @NotNull
        private Duration coolDown = Duration.ofSeconds(300);
    }
}
