package com.mirrortrader.position;

import com.mirrortrader.domain.model.Position;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable point-in-time copy of every position, handed to risk validation and monitoring.
 * Reading it never touches the tracker's live state.
 */
public final class PositionBook {

    private final Map<String, Position> positions;

    public PositionBook(Map<String, Position> positions) {
        this.positions = Map.copyOf(positions);
    }

    public static PositionBook empty() {
        return new PositionBook(Map.of());
    }

    public Optional<Position> position(String market) {
        return Optional.ofNullable(positions.get(market));
    }

    public BigDecimal signedSize(String market) {
        return position(market).map(Position::getSignedSize).orElse(BigDecimal.ZERO);
    }

    public BigDecimal exposure(String market) {
        return position(market).map(Position::getNotional).orElse(BigDecimal.ZERO);
    }

    /** Sum over markets of |signedSize| x lastPrice. */
    public BigDecimal totalExposure() {
        return positions.values().stream().map(Position::getNotional).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Collection<Position> positions() {
        return positions.values();
    }
}
