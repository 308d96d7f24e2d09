package com.mirrortrader.core.engine;

import com.mirrortrader.domain.enums.CircuitState;
import com.mirrortrader.domain.model.Order;
import com.mirrortrader.domain.model.Position;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Point-in-time health view of the engine for monitoring. */
@Value
@Builder
public class MirrorSnapshot {

    List<Position> positions;
    List<Order> openOrders;
    CircuitState circuitState;
    int retryQueueDepth;
    int deadLetterCount;
    BigDecimal totalExposure;
    BigDecimal fillRate;
    long retryAttempts;
    EngineStatistics.Snapshot statistics;
    boolean accepting;
    Instant takenAt;
}
