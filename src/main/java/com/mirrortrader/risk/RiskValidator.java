package com.mirrortrader.risk;

import com.mirrortrader.config.MirrorConfig;
import com.mirrortrader.domain.enums.OrderSide;
import com.mirrortrader.domain.model.MirrorAction;
import com.mirrortrader.domain.model.Order;
import com.mirrortrader.position.PositionBook;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Pre-trade gate for mirror actions.
 *
 * <p>Pure function of its inputs: it reads a {@link PositionBook} snapshot, the open mirror
 * orders and a {@link BalanceSnapshot}, never the trackers themselves, and has no side
 * effects. Checks run in a fixed order and stop at the first failure:
 * <ol>
 *   <li>Balance: required margin must fit the available collateral, and the balance must
 *       not be below the configured minimum</li>
 *   <li>Size bounds: order size at least the minimum; resulting position notional within
 *       the per-market ceiling</li>
 *   <li>Aggregate exposure: total exposure after the action within the portfolio ceiling</li>
 *   <li>Concentration (optional): market share of exposure after the action within the limit</li>
 * </ol>
 *
 * <p>An action that shrinks the absolute position in its market is de-risking. It needs no
 * new margin and bypasses the position, exposure and concentration ceilings, so an
 * over-limit book can always be reduced.
 *
 * <p>Open orders (PENDING, OPEN, PARTIALLY_FILLED) count as committed exposure at their
 * remaining size and limit price, but only those that would grow the position in their
 * market when filled: on a flat market both sides count, otherwise only the side of the
 * position. For the action's own market, committed orders on the action's side are added
 * to the resulting position.
 */
@Component
public class RiskValidator {

    public static final String INSUFFICIENT_BALANCE = "INSUFFICIENT_BALANCE";
    public static final String BALANCE_BELOW_MINIMUM = "BALANCE_BELOW_MINIMUM";
    public static final String ORDER_SIZE_BELOW_MINIMUM = "ORDER_SIZE_BELOW_MINIMUM";
    public static final String POSITION_LIMIT_EXCEEDED = "POSITION_LIMIT_EXCEEDED";
    public static final String EXPOSURE_LIMIT_EXCEEDED = "EXPOSURE_LIMIT_EXCEEDED";
    public static final String CONCENTRATION_LIMIT_EXCEEDED = "CONCENTRATION_LIMIT_EXCEEDED";

    private final RiskLimits riskLimits;
    private final BigDecimal marginRequirement;

    public RiskValidator(RiskLimits riskLimits, MirrorConfig mirrorConfig) {
        this.riskLimits = riskLimits;
        this.marginRequirement = mirrorConfig.getMarginRequirement();
    }

    /** Validates against positions alone, with no open orders committed. */
    public RiskValidationResult validate(MirrorAction action, PositionBook positions, BalanceSnapshot balance) {
        return validate(action, positions, List.of(), balance);
    }

    public RiskValidationResult validate(
            MirrorAction action, PositionBook positions, List<Order> openOrders, BalanceSnapshot balance) {
        String market = action.getMarket();
        BigDecimal currentSize = positions.signedSize(market);
        BigDecimal resultingSize = currentSize.add(action.getSignedSize());
        boolean reducing = resultingSize.abs().compareTo(currentSize.abs()) < 0;

        // Exposure added by this action, valued at the action price
        BigDecimal delta = resultingSize.abs().subtract(currentSize.abs()).multiply(action.getPrice());

        RiskViolation violation = reducing ? null : checkBalance(action, balance);
        if (violation == null) {
            BigDecimal committedSameSide = committedNotional(openOrders, market, action.getSide());
            violation = checkSize(action, resultingSize, committedSameSide, reducing);
        }
        BigDecimal committed = committedTotal(positions, openOrders);
        if (violation == null && !reducing) {
            violation = checkExposure(positions, committed, delta);
        }
        if (violation == null && !reducing) {
            BigDecimal marketExposure =
                    positions.exposure(market).add(committedGrowing(positions, openOrders, market));
            violation = checkConcentration(market, marketExposure, positions.totalExposure().add(committed), delta);
        }
        return violation == null ? RiskValidationResult.accepted() : RiskValidationResult.rejected(violation);
    }

    // ==================== Checks ====================

    private RiskViolation checkBalance(MirrorAction action, BalanceSnapshot balance) {
        BigDecimal required =
                marginRequirement != null ? action.getNotional().multiply(marginRequirement) : action.getNotional();
        if (required.compareTo(balance.available()) > 0) {
            return RiskViolation.of(
                    INSUFFICIENT_BALANCE,
                    String.format(
                            "insufficient balance: requires %s %s, available %s",
                            plain(required), balance.asset(), plain(balance.available())));
        }
        BigDecimal minBalance = riskLimits.getMinBalance();
        if (minBalance != null && balance.available().compareTo(minBalance) < 0) {
            return RiskViolation.of(
                    BALANCE_BELOW_MINIMUM,
                    String.format(
                            "balance below minimum: %s %s < %s",
                            plain(balance.available()), balance.asset(), plain(minBalance)));
        }
        return null;
    }

    private RiskViolation checkSize(
            MirrorAction action, BigDecimal resultingSize, BigDecimal committedSameSide, boolean reducing) {
        BigDecimal minOrderSize = riskLimits.getMinOrderSize();
        if (minOrderSize != null && action.getSize().compareTo(minOrderSize) < 0) {
            return RiskViolation.of(
                    ORDER_SIZE_BELOW_MINIMUM,
                    String.format("order size below minimum: %s < %s", plain(action.getSize()), plain(minOrderSize)));
        }
        BigDecimal maxPositionSize = riskLimits.getMaxPositionSize();
        if (!reducing && maxPositionSize != null) {
            BigDecimal resultingNotional =
                    resultingSize.abs().multiply(action.getPrice()).add(committedSameSide);
            if (resultingNotional.compareTo(maxPositionSize) > 0) {
                return RiskViolation.of(
                        POSITION_LIMIT_EXCEEDED,
                        String.format(
                                "position limit exceeded: would reach %s/%s in %s",
                                plain(resultingNotional), plain(maxPositionSize), action.getMarket()));
            }
        }
        return null;
    }

    private RiskViolation checkExposure(PositionBook positions, BigDecimal committed, BigDecimal delta) {
        BigDecimal maxTotalExposure = riskLimits.getMaxTotalExposure();
        if (maxTotalExposure == null) {
            return null;
        }
        BigDecimal resulting = positions.totalExposure().add(committed).add(delta);
        if (resulting.compareTo(maxTotalExposure) > 0) {
            return RiskViolation.of(
                    EXPOSURE_LIMIT_EXCEEDED,
                    String.format("exposure limit exceeded: would reach %s/%s", plain(resulting), plain(maxTotalExposure)));
        }
        return null;
    }

    private RiskViolation checkConcentration(
            String market, BigDecimal marketExposure, BigDecimal totalExposure, BigDecimal delta) {
        BigDecimal maxConcentration = riskLimits.getMaxMarketConcentration();
        if (maxConcentration == null) {
            return null;
        }
        BigDecimal resultingTotal = totalExposure.add(delta);
        if (resultingTotal.signum() <= 0) {
            return null;
        }
        BigDecimal share = marketExposure.add(delta).divide(resultingTotal, MathContext.DECIMAL64);
        if (share.compareTo(maxConcentration) > 0) {
            return RiskViolation.of(
                    CONCENTRATION_LIMIT_EXCEEDED,
                    String.format(
                            "market concentration exceeded: %s would reach %s/%s of total exposure",
                            market, plain(share.setScale(4, RoundingMode.HALF_UP)), plain(maxConcentration)));
        }
        return null;
    }

    // ==================== Open-order commitment ====================

    private static BigDecimal committedTotal(PositionBook positions, List<Order> openOrders) {
        return openOrders.stream()
                .filter(order -> growsPosition(positions, order))
                .map(RiskValidator::remainingNotional)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal committedGrowing(PositionBook positions, List<Order> openOrders, String market) {
        return openOrders.stream()
                .filter(order -> order.getMarket().equals(market) && growsPosition(positions, order))
                .map(RiskValidator::remainingNotional)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal committedNotional(List<Order> openOrders, String market, OrderSide side) {
        return openOrders.stream()
                .filter(order -> order.getMarket().equals(market) && order.getSide() == side)
                .map(RiskValidator::remainingNotional)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static boolean growsPosition(PositionBook positions, Order order) {
        int positionSign = positions.signedSize(order.getMarket()).signum();
        return positionSign == 0 || positionSign == order.getSide().signed(BigDecimal.ONE).signum();
    }

    private static BigDecimal remainingNotional(Order order) {
        return order.getRemainingSize().multiply(order.getPrice());
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
