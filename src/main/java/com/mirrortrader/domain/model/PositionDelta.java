package com.mirrortrader.domain.model;

import com.mirrortrader.domain.enums.PositionImpact;
import java.math.BigDecimal;

/** Effect of one fill on a market's position. realizedPnl is the amount realized by this fill alone. */
public record PositionDelta(
        String market,
        BigDecimal previousSize,
        BigDecimal newSize,
        BigDecimal averageEntryPrice,
        BigDecimal realizedPnl,
        PositionImpact impact) {}
