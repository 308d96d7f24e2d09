package com.mirrortrader.oms;

import com.mirrortrader.config.MirrorConfig;
import com.mirrortrader.domain.enums.OrderStatus;
import com.mirrortrader.domain.model.Fill;
import com.mirrortrader.domain.model.Order;
import com.mirrortrader.exception.DuplicateOrderException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Lifecycle state machine for mirror orders.
 *
 * <p>Maps source order identity to mirror order identity and reconciles what we intended to
 * trade with what the venue reports. Only observed events move an order forward:
 * <ul>
 *   <li>{@link #register} records a submitted order (PENDING while the venue has not
 *       assigned an id, OPEN once it has)</li>
 *   <li>{@link #acknowledge} promotes PENDING to OPEN when a queued submission is accepted</li>
 *   <li>{@link #applyFill} moves OPEN to PARTIALLY_FILLED or FILLED</li>
 *   <li>{@link #applyCancel} moves any live order to CANCELED</li>
 * </ul>
 * There are no timer-driven transitions. The scheduled sweep only forgets terminal orders
 * once they are older than the configured TTL.
 *
 * <p>Each order is updated atomically through {@link ConcurrentHashMap#compute}, and every
 * Order handed out is an immutable snapshot.
 */
@Service
public class OrderTracker {

    private static final Logger log = LoggerFactory.getLogger(OrderTracker.class);

    private final Clock clock;
    private final Duration terminalTtl;
    private final RecentFillWindow recentFills;

    /** clientOrderId -> order. The authoritative store. */
    private final Map<String, Order> orders = new ConcurrentHashMap<>();

    /** market:venue orderId -> clientOrderId. Each market numbers its orders independently. */
    private final Map<String, String> clientIdsByOrderId = new ConcurrentHashMap<>();

    /** market:sourceOrderId -> clientOrderId. */
    private final Map<String, String> clientIdsBySource = new ConcurrentHashMap<>();

    private final AtomicLong registeredCount = new AtomicLong();
    private final AtomicLong filledCount = new AtomicLong();

    public OrderTracker(MirrorConfig mirrorConfig, Clock clock) {
        this.clock = clock;
        this.terminalTtl = mirrorConfig.getTracker().getTerminalTtl();
        this.recentFills = new RecentFillWindow(mirrorConfig.getTracker().getRecentFillCapacity());
    }

    // ==================== Registration ====================

    /**
     * Records a mirror order once its submission has been accepted or queued.
     *
     * @throws DuplicateOrderException if the clientOrderId is already tracked
     * @throws IllegalArgumentException if the order is not a fresh PENDING or OPEN order
     */
    public Order register(Order order) {
        validateNew(order);
        Order existing = orders.putIfAbsent(order.getClientOrderId(), order);
        if (existing != null) {
            throw new DuplicateOrderException(order.getClientOrderId());
        }
        if (order.getOrderId() != null) {
            clientIdsByOrderId.put(orderKey(order.getMarket(), order.getOrderId()), order.getClientOrderId());
        }
        if (order.getSourceOrderId() != null) {
            clientIdsBySource.put(sourceKey(order.getMarket(), order.getSourceOrderId()), order.getClientOrderId());
        }
        registeredCount.incrementAndGet();

        log.info(
                "Order registered: clientOrderId={}, orderId={}, market={}, side={}, size={}, price={}, status={}",
                order.getClientOrderId(),
                order.getOrderId(),
                order.getMarket(),
                order.getSide(),
                order.getSize().toPlainString(),
                order.getPrice().toPlainString(),
                order.getStatus());
        return order;
    }

    /**
     * Attaches the venue order id to a PENDING order and moves it to OPEN.
     *
     * <p>If the order was canceled while its submission was in flight, the id is still
     * recorded (so later events for it resolve) but the status stays CANCELED; the caller
     * sees that in the returned snapshot and must pull the stale order from the venue.
     */
    public Optional<Order> acknowledge(String clientOrderId, long orderId) {
        Order updated = orders.computeIfPresent(clientOrderId, (id, order) -> {
            if (order.getStatus() == OrderStatus.PENDING) {
                return order.toBuilder()
                        .orderId(orderId)
                        .status(OrderStatus.OPEN)
                        .updatedAt(clock.instant())
                        .build();
            }
            if (order.getOrderId() == null) {
                log.warn(
                        "Venue accepted order no longer wanted: clientOrderId={}, orderId={}, status={}",
                        clientOrderId,
                        orderId,
                        order.getStatus());
                return order.toBuilder().orderId(orderId).build();
            }
            return order;
        });
        if (updated == null) {
            return Optional.empty();
        }
        clientIdsByOrderId.put(orderKey(updated.getMarket(), orderId), clientOrderId);
        log.info("Order acknowledged: clientOrderId={}, orderId={}, status={}", clientOrderId, orderId, updated.getStatus());
        return Optional.of(updated);
    }

    /** Moves a PENDING order to FAILED after its submission was permanently refused. */
    public boolean markFailed(String clientOrderId, String reason) {
        AtomicReference<Boolean> changed = new AtomicReference<>(false);
        orders.computeIfPresent(clientOrderId, (id, order) -> {
            if (order.getStatus() != OrderStatus.PENDING) {
                return order;
            }
            changed.set(true);
            return transition(order, OrderStatus.FAILED).build();
        });
        if (changed.get()) {
            log.warn("Order failed: clientOrderId={}, reason={}", clientOrderId, reason);
        }
        return changed.get();
    }

    // ==================== Fills ====================

    /**
     * Applies an observed fill to the order it references.
     *
     * <p>Never throws for feed anomalies: unknown orders, replays, fills on terminal orders
     * and fills larger than the remaining size are all reported through the outcome.
     *
     * @param market market the fill was observed on; venue order ids are only unique within it
     */
    public FillOutcome applyFill(String market, Fill fill) {
        String clientOrderId = clientIdsByOrderId.get(orderKey(market, fill.orderId()));
        if (clientOrderId == null) {
            log.debug(
                    "Fill for untracked order ignored: market={}, orderId={}, seq={}",
                    market,
                    fill.orderId(),
                    fill.sequenceMarker());
            return FillOutcome.unknownOrder();
        }

        String dedupKey = market + ":" + fill.dedupKey();
        AtomicReference<FillOutcome> outcome = new AtomicReference<>(FillOutcome.unknownOrder());
        orders.computeIfPresent(clientOrderId, (id, order) -> {
            if (recentFills.contains(dedupKey)) {
                outcome.set(FillOutcome.duplicate(order));
                return order;
            }
            if (order.isTerminal()) {
                logTerminalFill(order, fill);
                outcome.set(FillOutcome.terminalIgnored(order));
                return order;
            }

            BigDecimal remaining = order.getRemainingSize();
            BigDecimal applied = fill.filledSize().min(remaining);
            boolean capped = applied.compareTo(fill.filledSize()) < 0;
            if (capped) {
                log.warn(
                        "Fill overruns order size, capping: orderId={}, fillSize={}, remaining={}, size={}",
                        fill.orderId(),
                        fill.filledSize().toPlainString(),
                        remaining.toPlainString(),
                        order.getSize().toPlainString());
            }

            BigDecimal newRemaining = remaining.subtract(applied);
            OrderStatus next = newRemaining.signum() == 0 ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
            Order updated = transition(order, next).remainingSize(newRemaining).build();
            recentFills.add(dedupKey);
            if (next == OrderStatus.FILLED) {
                filledCount.incrementAndGet();
            }
            outcome.set(FillOutcome.applied(updated, applied, capped));
            return updated;
        });

        FillOutcome result = outcome.get();
        if (result.kind() == FillOutcome.Kind.DUPLICATE) {
            log.debug("Duplicate fill ignored: orderId={}, seq={}", fill.orderId(), fill.sequenceMarker());
        } else if (result.isApplied()) {
            log.info(
                    "Fill applied: orderId={}, seq={}, applied={}, remaining={}, status={}",
                    fill.orderId(),
                    fill.sequenceMarker(),
                    result.appliedSize().toPlainString(),
                    result.order().getRemainingSize().toPlainString(),
                    result.order().getStatus());
        }
        return result;
    }

    // ==================== Cancels ====================

    public CancelOutcome applyCancel(String market, long orderId) {
        return applyCancel(market, orderId, null);
    }

    /**
     * Cancels a live order observed closed on the feed. remainingSize is frozen as is.
     *
     * @param sequenceMarker feed position of the cancel event, kept to diagnose fills that
     *     arrive after it; may be null
     */
    public CancelOutcome applyCancel(String market, long orderId, Long sequenceMarker) {
        String clientOrderId = clientIdsByOrderId.get(orderKey(market, orderId));
        if (clientOrderId == null) {
            log.debug("Cancel for untracked order ignored: market={}, orderId={}", market, orderId);
            return CancelOutcome.UNKNOWN_ORDER;
        }
        return cancel(clientOrderId, sequenceMarker);
    }

    /** Cancels an order that never reached the venue (withdrawn from the retry queue). */
    public CancelOutcome cancelPending(String clientOrderId) {
        Order order = orders.get(clientOrderId);
        if (order == null) {
            return CancelOutcome.UNKNOWN_ORDER;
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            log.debug("Not pending, cancel skipped: clientOrderId={}, status={}", clientOrderId, order.getStatus());
            return order.isTerminal() ? CancelOutcome.ALREADY_TERMINAL : CancelOutcome.NOT_PENDING;
        }
        return cancel(clientOrderId, null);
    }

    private CancelOutcome cancel(String clientOrderId, Long sequenceMarker) {
        AtomicReference<CancelOutcome> outcome = new AtomicReference<>(CancelOutcome.UNKNOWN_ORDER);
        orders.computeIfPresent(clientOrderId, (id, order) -> {
            if (order.isTerminal()) {
                outcome.set(CancelOutcome.ALREADY_TERMINAL);
                return order;
            }
            outcome.set(CancelOutcome.CANCELED);
            return transition(order, OrderStatus.CANCELED)
                    .closedSequence(sequenceMarker)
                    .build();
        });

        if (outcome.get() == CancelOutcome.ALREADY_TERMINAL) {
            log.info("Cancel for terminal order is a no-op: clientOrderId={}", clientOrderId);
        } else if (outcome.get() == CancelOutcome.CANCELED) {
            log.info("Order canceled: clientOrderId={}, seq={}", clientOrderId, sequenceMarker);
        }
        return outcome.get();
    }

    // ==================== Queries ====================

    public Optional<Order> find(String clientOrderId) {
        return Optional.ofNullable(orders.get(clientOrderId));
    }

    public Optional<Order> findByOrderId(String market, long orderId) {
        return Optional.ofNullable(clientIdsByOrderId.get(orderKey(market, orderId))).map(orders::get);
    }

    /** Resolves the mirror of a source order. */
    public Optional<Order> findBySource(String market, long sourceOrderId) {
        return Optional.ofNullable(clientIdsBySource.get(sourceKey(market, sourceOrderId)))
                .map(orders::get);
    }

    /** Non-terminal orders, oldest first. */
    public List<Order> openOrders() {
        return orders.values().stream()
                .filter(order -> !order.isTerminal())
                .sorted(Comparator.comparing(Order::getCreatedAt))
                .toList();
    }

    public List<Order> allOrders() {
        return orders.values().stream()
                .sorted(Comparator.comparing(Order::getCreatedAt))
                .toList();
    }

    public int getTrackedCount() {
        return orders.size();
    }

    /** Share of registered orders that filled completely; zero before any registration. */
    public BigDecimal fillRate() {
        long registered = registeredCount.get();
        if (registered == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(filledCount.get()).divide(BigDecimal.valueOf(registered), MathContext.DECIMAL64);
    }

    // ==================== Eviction ====================

    /** Forgets terminal orders older than the TTL. Later events for them resolve as unknown. */
    @Scheduled(fixedDelayString = "${mirror.tracker.eviction-interval-ms:60000}")
    public int evictTerminalOrders() {
        Instant cutoff = clock.instant().minus(terminalTtl);
        int evicted = 0;
        for (Order order : List.copyOf(orders.values())) {
            if (order.isTerminal() && order.getUpdatedAt().isBefore(cutoff)) {
                if (orders.remove(order.getClientOrderId(), order)) {
                    if (order.getOrderId() != null) {
                        clientIdsByOrderId.remove(
                                orderKey(order.getMarket(), order.getOrderId()), order.getClientOrderId());
                    }
                    if (order.getSourceOrderId() != null) {
                        clientIdsBySource.remove(
                                sourceKey(order.getMarket(), order.getSourceOrderId()), order.getClientOrderId());
                    }
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} terminal orders older than {}", evicted, terminalTtl);
        }
        return evicted;
    }

    // ==================== Internals ====================

    private Order.OrderBuilder transition(Order order, OrderStatus target) {
        if (!order.getStatus().canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                    "Illegal order transition %s -> %s for clientOrderId=%s",
                    order.getStatus(), target, order.getClientOrderId()));
        }
        return order.toBuilder().status(target).updatedAt(clock.instant());
    }

    private void logTerminalFill(Order order, Fill fill) {
        if (order.getStatus() == OrderStatus.CANCELED && order.getClosedSequence() != null) {
            log.warn(
                    "Fill after cancel discarded: orderId={}, fillSeq={}, cancelSeq={}, fillPrecedesCancel={}, size={}",
                    fill.orderId(),
                    fill.sequenceMarker(),
                    order.getClosedSequence(),
                    fill.sequenceMarker() < order.getClosedSequence(),
                    fill.filledSize().toPlainString());
        } else {
            log.warn(
                    "Fill for terminal order discarded: orderId={}, status={}, seq={}, size={}",
                    fill.orderId(),
                    order.getStatus(),
                    fill.sequenceMarker(),
                    fill.filledSize().toPlainString());
        }
    }

    private static void validateNew(Order order) {
        String clientOrderId = order.getClientOrderId();
        if (clientOrderId == null || clientOrderId.isBlank() || clientOrderId.length() > ClientOrderIds.MAX_LENGTH) {
            throw new IllegalArgumentException("clientOrderId must be 1-36 characters, was: " + clientOrderId);
        }
        if (order.getStatus() != OrderStatus.PENDING && order.getStatus() != OrderStatus.OPEN) {
            throw new IllegalArgumentException("New orders must be PENDING or OPEN, was " + order.getStatus());
        }
        if (order.getStatus() == OrderStatus.OPEN && order.getOrderId() == null) {
            throw new IllegalArgumentException("OPEN order requires a venue orderId: " + clientOrderId);
        }
        if (order.getSize().signum() <= 0 || order.getRemainingSize().compareTo(order.getSize()) != 0) {
            throw new IllegalArgumentException("New order must have positive size with nothing filled: " + clientOrderId);
        }
    }

    private static String sourceKey(String market, long sourceOrderId) {
        return market + ":" + sourceOrderId;
    }

    private static String orderKey(String market, long orderId) {
        return market + ":" + orderId;
    }
}
