package com.mirrortrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Net position in one market.
 *
 * <p>signedSize is positive when long, negative when short and zero when flat.
 * averageEntryPrice is null whenever the position is flat.
 */
@Value
@Builder(toBuilder = true)
public class Position {

    String market;
    BigDecimal signedSize;
    BigDecimal averageEntryPrice;
    BigDecimal realizedPnl;
    BigDecimal lastPrice;

    public static Position flat(String market) {
        return Position.builder()
                .market(market)
                .signedSize(BigDecimal.ZERO)
                .realizedPnl(BigDecimal.ZERO)
                .build();
    }

    public boolean isFlat() {
        return signedSize.signum() == 0;
    }

    /** |signedSize| x lastPrice, zero when flat or never priced. */
    public BigDecimal getNotional() {
        if (isFlat() || lastPrice == null) {
            return BigDecimal.ZERO;
        }
        return signedSize.abs().multiply(lastPrice);
    }
}
