package com.mirrortrader.risk;

import com.mirrortrader.config.MirrorConfig;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Turns a source order size into the mirror order size: source size x copy ratio, rounded
 * down to the configured size increment. Rounding down keeps the mirror at or below the
 * intended ratio.
 */
@Component
public class MirrorSizer {

    private final BigDecimal copyRatio;
    private final BigDecimal sizeIncrement;

    public MirrorSizer(MirrorConfig mirrorConfig) {
        this.copyRatio = mirrorConfig.getCopyRatio();
        this.sizeIncrement = mirrorConfig.getSizeIncrement();
    }

    /** Returns the mirror size, or empty when it rounds down to nothing. */
    public Optional<BigDecimal> size(BigDecimal sourceSize) {
        BigDecimal scaled = sourceSize.multiply(copyRatio);
        if (sizeIncrement != null && sizeIncrement.signum() > 0) {
            BigDecimal lots = scaled.divide(sizeIncrement, 0, RoundingMode.DOWN);
            scaled = lots.multiply(sizeIncrement);
        }
        return scaled.signum() > 0 ? Optional.of(scaled) : Optional.empty();
    }
}
