package com.mirrortrader.config;

import com.mirrortrader.risk.RiskLimits;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} bean from {@code mirror.risk.*}.
 *
 * <p>Every limit defaults to null (check skipped) when the property is absent; the shipped
 * application.yml sets the production defaults. Startup fails if the per-market position
 * ceiling is configured above the portfolio exposure ceiling.
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${mirror.risk.min-order-size:#{null}}") BigDecimal minOrderSize,
            @Value("${mirror.risk.max-position-size:#{null}}") BigDecimal maxPositionSize,
            @Value("${mirror.risk.max-total-exposure:#{null}}") BigDecimal maxTotalExposure,
            @Value("${mirror.risk.max-market-concentration:#{null}}") BigDecimal maxMarketConcentration,
            @Value("${mirror.risk.min-balance:#{null}}") BigDecimal minBalance) {
        RiskLimits limits = RiskLimits.builder()
                .minOrderSize(minOrderSize)
                .maxPositionSize(maxPositionSize)
                .maxTotalExposure(maxTotalExposure)
                .maxMarketConcentration(maxMarketConcentration)
                .minBalance(minBalance)
                .build();
        limits.validate();
        return limits;
    }
}
