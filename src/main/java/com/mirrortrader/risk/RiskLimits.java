package com.mirrortrader.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Limits every mirrored action is validated against.
 *
 * <p>Null values mean the check is disabled. Sizes are in base-asset units; position and
 * exposure ceilings are notional in the market's quote asset.
 */
@Data
@Builder
public class RiskLimits {

    // ==================== Per-Action Limits ====================

    /** Smallest mirror order size accepted. */
    private BigDecimal minOrderSize;

    /** Maximum notional of the resulting position in one market. */
    private BigDecimal maxPositionSize;

    // ==================== Portfolio Limits ====================

    /** Ceiling on total exposure summed across markets. */
    private BigDecimal maxTotalExposure;

    /** Maximum share of total exposure held in one market (e.g. 0.5 = 50%). Null = disabled. */
    private BigDecimal maxMarketConcentration;

    // ==================== Balance Limits ====================

    /** Exposure-increasing actions are refused while available balance is below this. */
    private BigDecimal minBalance;

    /**
     * Checks the limits are consistent with each other.
     *
     * @throws IllegalStateException if maxPositionSize exceeds maxTotalExposure or a
     *     concentration outside (0, 1] is configured
     */
    public void validate() {
        if (maxPositionSize != null && maxTotalExposure != null && maxPositionSize.compareTo(maxTotalExposure) > 0) {
            throw new IllegalStateException(String.format(
                    "mirror.risk.max-position-size (%s) must not exceed mirror.risk.max-total-exposure (%s)",
                    maxPositionSize.toPlainString(), maxTotalExposure.toPlainString()));
        }
        if (maxMarketConcentration != null
                && (maxMarketConcentration.signum() <= 0 || maxMarketConcentration.compareTo(BigDecimal.ONE) > 0)) {
            throw new IllegalStateException(
                    "mirror.risk.max-market-concentration must be in (0, 1], was " + maxMarketConcentration);
        }
    }
}
