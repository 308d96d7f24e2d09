package com.mirrortrader.position;

import com.mirrortrader.domain.enums.OrderSide;
import com.mirrortrader.domain.enums.PositionImpact;
import com.mirrortrader.domain.model.Position;
import com.mirrortrader.domain.model.PositionDelta;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Aggregates confirmed mirror fills into one {@link Position} per market.
 *
 * <p>Sole owner of position state: every mutation goes through {@link #applyFill}. Each
 * market's position is replaced atomically, so markets processed on different threads never
 * contend and readers only ever see whole positions.
 *
 * <p>Per-fill algorithm:
 * <ul>
 *   <li><b>Same direction or flat:</b> size grows, average entry becomes the size-weighted
 *       mean of the old entry and the fill price</li>
 *   <li><b>Opposite, not larger than the position:</b> realize
 *       {@code closed x (fillPrice - avgEntry) x sign(size)}, size shrinks, average entry kept;
 *       reaching exactly zero clears the average entry</li>
 *   <li><b>Opposite and larger (flip):</b> realize on the whole existing size, then open the
 *       excess in the other direction at the fill price</li>
 * </ul>
 */
@Service
public class PositionTracker {

    private static final Logger log = LoggerFactory.getLogger(PositionTracker.class);

    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    /**
     * Applies one fill and returns its effect on the market's position.
     *
     * @param size unsigned fill quantity, must be positive
     */
    public PositionDelta applyFill(String market, OrderSide side, BigDecimal size, BigDecimal price) {
        if (size.signum() <= 0) {
            throw new IllegalArgumentException("Fill size must be positive, was " + size);
        }
        AtomicReference<PositionDelta> delta = new AtomicReference<>();
        positions.compute(market, (key, current) -> {
            Position base = current != null ? current : Position.flat(market);
            return apply(base, side.signed(size), price, delta);
        });

        PositionDelta result = delta.get();
        log.info(
                "Position updated: market={}, impact={}, size {} -> {}, avgEntry={}, realized={}",
                market,
                result.impact(),
                result.previousSize().toPlainString(),
                result.newSize().toPlainString(),
                result.averageEntryPrice(),
                result.realizedPnl().toPlainString());
        return result;
    }

    /** signedSize x (mark - avgEntry); zero when flat or unknown. */
    public BigDecimal unrealizedPnl(String market, BigDecimal markPrice) {
        Position position = positions.get(market);
        if (position == null || position.isFlat()) {
            return BigDecimal.ZERO;
        }
        return position.getSignedSize().multiply(markPrice.subtract(position.getAverageEntryPrice()));
    }

    /** Updates the last price used for exposure without touching size or PnL. */
    public void updateMark(String market, BigDecimal markPrice) {
        positions.computeIfPresent(
                market, (key, position) -> position.toBuilder().lastPrice(markPrice).build());
    }

    public BigDecimal totalExposure() {
        return positions.values().stream().map(Position::getNotional).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Position getPosition(String market) {
        return positions.getOrDefault(market, Position.flat(market));
    }

    public PositionBook snapshot() {
        return new PositionBook(new HashMap<>(positions));
    }

    // ==================== Fill Arithmetic ====================

    private Position apply(Position current, BigDecimal signedFill, BigDecimal price, AtomicReference<PositionDelta> out) {
        BigDecimal oldSize = current.getSignedSize();
        BigDecimal newSize = oldSize.add(signedFill);
        BigDecimal fillQty = signedFill.abs();
        BigDecimal realized = BigDecimal.ZERO;
        BigDecimal avgEntry;
        PositionImpact impact;

        if (oldSize.signum() == 0 || oldSize.signum() == signedFill.signum()) {
            BigDecimal oldQty = oldSize.abs();
            BigDecimal oldCost = oldSize.signum() == 0 ? BigDecimal.ZERO : oldQty.multiply(current.getAverageEntryPrice());
            avgEntry = oldCost.add(fillQty.multiply(price)).divide(oldQty.add(fillQty), MathContext.DECIMAL128);
            impact = oldSize.signum() == 0 ? PositionImpact.OPENED : PositionImpact.INCREASED;
        } else if (fillQty.compareTo(oldSize.abs()) <= 0) {
            realized = realize(fillQty, price, current.getAverageEntryPrice(), oldSize.signum());
            if (newSize.signum() == 0) {
                avgEntry = null;
                impact = PositionImpact.CLOSED;
            } else {
                avgEntry = current.getAverageEntryPrice();
                impact = PositionImpact.REDUCED;
            }
        } else {
            realized = realize(oldSize.abs(), price, current.getAverageEntryPrice(), oldSize.signum());
            avgEntry = price;
            impact = PositionImpact.FLIPPED;
        }

        out.set(new PositionDelta(current.getMarket(), oldSize, newSize, avgEntry, realized, impact));
        return current.toBuilder()
                .signedSize(newSize)
                .averageEntryPrice(avgEntry)
                .realizedPnl(current.getRealizedPnl().add(realized))
                .lastPrice(price)
                .build();
    }

    private static BigDecimal realize(BigDecimal closedQty, BigDecimal price, BigDecimal avgEntry, int direction) {
        return closedQty.multiply(price.subtract(avgEntry)).multiply(BigDecimal.valueOf(direction));
    }
}
