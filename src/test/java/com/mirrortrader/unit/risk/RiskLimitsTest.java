package com.mirrortrader.unit.risk;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mirrortrader.config.RiskConfig;
import com.mirrortrader.risk.RiskLimits;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RiskLimitsTest {

    private final RiskConfig riskConfig = new RiskConfig();

    @Test
    @DisplayName("Shipped defaults are consistent")
    void defaults_areValid() {
        assertThatCode(() -> riskConfig.riskLimits(
                        new BigDecimal("10"), new BigDecimal("1000"), new BigDecimal("5000"), null, new BigDecimal("100")))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Per-market ceiling above the portfolio ceiling fails startup")
    void positionAboveTotal_throws() {
        assertThatThrownBy(() -> riskConfig.riskLimits(null, new BigDecimal("6000"), new BigDecimal("5000"), null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("max-position-size");
    }

    @Test
    @DisplayName("Concentration must lie in (0, 1]")
    void concentrationOutOfRange_throws() {
        RiskLimits limits = RiskLimits.builder().maxMarketConcentration(new BigDecimal("1.5")).build();

        assertThatThrownBy(limits::validate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Unset limits are skipped")
    void allNull_isValid() {
        assertThatCode(() -> RiskLimits.builder().build().validate()).doesNotThrowAnyException();
    }
}
