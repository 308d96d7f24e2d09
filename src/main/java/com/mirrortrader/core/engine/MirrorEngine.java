package com.mirrortrader.core.engine;

import com.mirrortrader.broker.BalanceSource;
import com.mirrortrader.broker.ExecutionClient;
import com.mirrortrader.config.MirrorConfig;
import com.mirrortrader.domain.enums.OrderStatus;
import com.mirrortrader.domain.model.MirrorAction;
import com.mirrortrader.domain.model.Order;
import com.mirrortrader.exception.DuplicateOrderException;
import com.mirrortrader.exception.NormalizationException;
import com.mirrortrader.exception.SubmissionException;
import com.mirrortrader.feed.EventNormalizer;
import com.mirrortrader.feed.FeedEvent;
import com.mirrortrader.feed.FeedEventHandler;
import com.mirrortrader.feed.FilledEvent;
import com.mirrortrader.feed.OrderOpenedEvent;
import com.mirrortrader.feed.OrdersClosedEvent;
import com.mirrortrader.feed.RawFeedEvent;
import com.mirrortrader.observability.MirrorMetrics;
import com.mirrortrader.oms.CancelOutcome;
import com.mirrortrader.oms.ClientOrderIds;
import com.mirrortrader.oms.FillOutcome;
import com.mirrortrader.oms.OrderTracker;
import com.mirrortrader.position.PositionTracker;
import com.mirrortrader.retry.DeadLetterLog;
import com.mirrortrader.retry.RetryCoordinator;
import com.mirrortrader.retry.RetryItem;
import com.mirrortrader.retry.RetryOutcomeEvent;
import com.mirrortrader.retry.SubmissionResult;
import com.mirrortrader.risk.BalanceSnapshot;
import com.mirrortrader.risk.MirrorSizer;
import com.mirrortrader.risk.RiskValidationResult;
import com.mirrortrader.risk.RiskValidator;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Single entry point that turns feed events into mirror orders and keeps order and position
 * state reconciled.
 *
 * <p>Per event kind:
 * <ul>
 *   <li><b>OrderOpened</b> (source wallet): size the mirror, validate it against position
 *       and open-order snapshots and the current balance, submit through the {@link RetryCoordinator}, then
 *       register it with the {@link OrderTracker}: OPEN when accepted, PENDING when queued</li>
 *   <li><b>Filled</b>: apply to the OrderTracker; only a fill the tracker actually applied
 *       reaches the {@link PositionTracker}, with the capped size</li>
 *   <li><b>OrdersClosed</b> from a source wallet: withdraw PENDING mirrors from the retry
 *       queue and cancel live ones at the venue. From our own wallet: the venue confirms the
 *       cancellation, so the orders move to CANCELED</li>
 * </ul>
 *
 * <p>Every branch catches and logs its own failures. A bad event is counted and skipped,
 * and the event loop carries on. An open circuit breaker only blocks new submissions; fills
 * and cancels keep flowing.
 */
@Service
public class MirrorEngine implements FeedEventHandler {

    private static final Logger log = LoggerFactory.getLogger(MirrorEngine.class);

    private final EventNormalizer eventNormalizer;
    private final OrderTracker orderTracker;
    private final PositionTracker positionTracker;
    private final RiskValidator riskValidator;
    private final MirrorSizer mirrorSizer;
    private final RetryCoordinator retryCoordinator;
    private final DeadLetterLog deadLetterLog;
    private final ExecutionClient executionClient;
    private final BalanceSource balanceSource;
    private final MirrorMetrics metrics;
    private final MirrorConfig mirrorConfig;
    private final Clock clock;

    private final EngineStatistics statistics = new EngineStatistics();
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public MirrorEngine(
            EventNormalizer eventNormalizer,
            OrderTracker orderTracker,
            PositionTracker positionTracker,
            RiskValidator riskValidator,
            MirrorSizer mirrorSizer,
            RetryCoordinator retryCoordinator,
            DeadLetterLog deadLetterLog,
            ExecutionClient executionClient,
            BalanceSource balanceSource,
            MirrorMetrics metrics,
            MirrorConfig mirrorConfig,
            Clock clock) {
        this.eventNormalizer = eventNormalizer;
        this.orderTracker = orderTracker;
        this.positionTracker = positionTracker;
        this.riskValidator = riskValidator;
        this.mirrorSizer = mirrorSizer;
        this.retryCoordinator = retryCoordinator;
        this.deadLetterLog = deadLetterLog;
        this.executionClient = executionClient;
        this.balanceSource = balanceSource;
        this.metrics = metrics;
        this.mirrorConfig = mirrorConfig;
        this.clock = clock;
    }

    // ==================== Entry Point ====================

    @Override
    public void handle(RawFeedEvent rawEvent) {
        if (!accepting.get()) {
            log.debug("Engine stopped, event dropped: market={}, type={}", rawEvent.market(), rawEvent.eventType());
            return;
        }

        Optional<FeedEvent> normalized;
        try {
            normalized = eventNormalizer.normalize(rawEvent);
        } catch (NormalizationException e) {
            metrics.recordNormalizationFailure();
            log.error("Dropping malformed event: {} raw={}", e.getMessage(), e.getRawPayload());
            return;
        }
        if (normalized.isEmpty()) {
            metrics.recordFilteredEvent();
            return;
        }

        FeedEvent event = normalized.get();
        try {
            switch (event.type()) {
                case ORDER_OPENED -> onOrderOpened((OrderOpenedEvent) event);
                case FILLED -> onFilled((FilledEvent) event);
                case ORDERS_CLOSED -> onOrdersClosed((OrdersClosedEvent) event);
            }
        } catch (RuntimeException e) {
            metrics.recordHandlerError(event.type());
            log.error("Failed to handle event: market={}, kind={}", event.market(), event.type(), e);
        }
    }

    // ==================== OrderOpened ====================

    private void onOrderOpened(OrderOpenedEvent event) {
        statistics.orderDetected();
        String clientOrderId = ClientOrderIds.forSource(event.market(), event.sourceOrderId());
        if (orderTracker.find(clientOrderId).isPresent() || retryCoordinator.isPending(clientOrderId)) {
            log.debug(
                    "Source order already mirrored: market={}, sourceOrderId={}, clientOrderId={}",
                    event.market(),
                    event.sourceOrderId(),
                    clientOrderId);
            return;
        }

        Optional<BigDecimal> mirrorSize = mirrorSizer.size(event.size());
        if (mirrorSize.isEmpty()) {
            statistics.orderRejected();
            log.info(
                    "Not mirroring: size rounds to zero, market={}, sourceOrderId={}, sourceSize={}",
                    event.market(),
                    event.sourceOrderId(),
                    event.size().toPlainString());
            return;
        }

        MirrorAction action = MirrorAction.builder()
                .clientOrderId(clientOrderId)
                .market(event.market())
                .sourceOrderId(event.sourceOrderId())
                .side(event.side())
                .price(event.price())
                .size(mirrorSize.get())
                .build();

        String asset = mirrorConfig.collateralAssetFor(event.market());
        BalanceSnapshot balance = new BalanceSnapshot(asset, balanceSource.currentBalance(asset));
        RiskValidationResult risk =
                riskValidator.validate(action, positionTracker.snapshot(), orderTracker.openOrders(), balance);
        if (risk.isRejected()) {
            statistics.orderRejected();
            metrics.recordRiskRejection(risk.getViolation().getCode());
            log.warn(
                    "Mirror rejected by risk: market={}, sourceOrderId={}, side={}, size={}, reason={}",
                    event.market(),
                    event.sourceOrderId(),
                    action.getSide(),
                    action.getSize().toPlainString(),
                    risk.getViolation().getMessage());
            return;
        }

        SubmissionResult result = retryCoordinator.submit(action);
        metrics.recordSubmission(result.status());
        switch (result.status()) {
            case ACCEPTED -> {
                registerMirror(action, OrderStatus.OPEN, result.orderId());
                statistics.orderMirrored();
            }
            case QUEUED -> {
                registerMirror(action, OrderStatus.PENDING, null);
                statistics.orderQueued();
            }
            case REJECTED, CIRCUIT_OPEN -> {
                statistics.orderRejected();
                log.warn(
                        "Mirror not placed: market={}, sourceOrderId={}, status={}, reason={}",
                        event.market(),
                        event.sourceOrderId(),
                        result.status(),
                        result.reason());
            }
        }
    }

    private void registerMirror(MirrorAction action, OrderStatus status, Long orderId) {
        Order order = Order.builder()
                .orderId(orderId)
                .clientOrderId(action.getClientOrderId())
                .sourceOrderId(action.getSourceOrderId())
                .market(action.getMarket())
                .side(action.getSide())
                .price(action.getPrice())
                .size(action.getSize())
                .remainingSize(action.getSize())
                .status(status)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        try {
            orderTracker.register(order);
        } catch (DuplicateOrderException e) {
            // A retry was accepted and registered before the queued result got here
            log.debug("Mirror already registered: clientOrderId={}", action.getClientOrderId());
        }
    }

    // ==================== Filled ====================

    private void onFilled(FilledEvent event) {
        FillOutcome outcome = orderTracker.applyFill(event.market(), event.fill());
        metrics.recordFill(outcome);
        if (!outcome.isApplied()) {
            return;
        }
        Order order = outcome.order();
        positionTracker.applyFill(order.getMarket(), order.getSide(), outcome.appliedSize(), event.fill().price());
        statistics.fillApplied();
    }

    // ==================== OrdersClosed ====================

    private void onOrdersClosed(OrdersClosedEvent event) {
        if (mirrorConfig.isOwnWallet(event.owner())) {
            for (Long orderId : event.orderIds()) {
                CancelOutcome outcome = orderTracker.applyCancel(event.market(), orderId, event.sequenceMarker());
                if (outcome == CancelOutcome.CANCELED) {
                    statistics.orderCanceled();
                }
            }
            return;
        }

        List<Long> liveOrderIds = new ArrayList<>();
        for (Long sourceOrderId : event.orderIds()) {
            Optional<Order> mirror = orderTracker.findBySource(event.market(), sourceOrderId);
            if (mirror.isEmpty()) {
                String clientOrderId = ClientOrderIds.forSource(event.market(), sourceOrderId);
                if (!retryCoordinator.withdraw(clientOrderId)) {
                    log.debug("Source cancel has no mirror: market={}, sourceOrderId={}", event.market(), sourceOrderId);
                }
                continue;
            }

            Order order = mirror.get();
            if (order.getStatus() == OrderStatus.PENDING) {
                retryCoordinator.withdraw(order.getClientOrderId());
                if (orderTracker.cancelPending(order.getClientOrderId()) == CancelOutcome.CANCELED) {
                    statistics.orderCanceled();
                }
            } else if (order.getStatus().isLive()) {
                liveOrderIds.add(order.getOrderId());
            } else {
                log.debug(
                        "Mirror already terminal: clientOrderId={}, status={}",
                        order.getClientOrderId(),
                        order.getStatus());
            }
        }

        if (!liveOrderIds.isEmpty()) {
            cancelAtVenue(event.market(), liveOrderIds);
        }
    }

    /** Requests the cancel; the orders move to CANCELED when the venue's own cancel event arrives. */
    private void cancelAtVenue(String market, List<Long> orderIds) {
        try {
            executionClient.cancelOrders(market, orderIds);
            log.info("Cancel requested at venue: market={}, orderIds={}", market, orderIds);
        } catch (SubmissionException e) {
            metrics.recordCancelFailure();
            log.error("Venue cancel failed: market={}, orderIds={}, error={}", market, orderIds, e.describe());
        }
    }

    // ==================== Retry Outcomes ====================

    @EventListener
    public void onRetryOutcome(RetryOutcomeEvent event) {
        MirrorAction action = event.getAction();
        try {
            switch (event.getType()) {
                case ACCEPTED -> onRetryAccepted(action, event.getOrderId());
                case DEAD_LETTERED -> {
                    metrics.recordDeadLetter();
                    orderTracker.markFailed(action.getClientOrderId(), event.getDeadLetter().lastError());
                }
            }
        } catch (RuntimeException e) {
            log.error(
                    "Failed to apply retry outcome: clientOrderId={}, type={}",
                    action.getClientOrderId(),
                    event.getType(),
                    e);
        }
    }

    private void onRetryAccepted(MirrorAction action, long orderId) {
        metrics.recordSubmission(SubmissionResult.Status.ACCEPTED);
        statistics.orderMirrored();
        Optional<Order> acknowledged = orderTracker.acknowledge(action.getClientOrderId(), orderId);
        if (acknowledged.isEmpty()) {
            registerMirror(action, OrderStatus.OPEN, orderId);
            return;
        }
        if (acknowledged.get().getStatus() == OrderStatus.CANCELED) {
            log.warn(
                    "Source order was canceled while its retry was in flight, pulling orderId={} clientOrderId={}",
                    orderId,
                    action.getClientOrderId());
            cancelAtVenue(action.getMarket(), List.of(orderId));
        }
    }

    // ==================== Monitoring & Shutdown ====================

    public MirrorSnapshot snapshot() {
        return MirrorSnapshot.builder()
                .positions(List.copyOf(positionTracker.snapshot().positions()))
                .openOrders(orderTracker.openOrders())
                .circuitState(retryCoordinator.getCircuitState())
                .retryQueueDepth(retryCoordinator.getQueueDepth())
                .deadLetterCount(deadLetterLog.size())
                .totalExposure(positionTracker.totalExposure())
                .fillRate(orderTracker.fillRate())
                .retryAttempts(retryCoordinator.getRetryAttempts())
                .statistics(statistics.snapshot())
                .accepting(accepting.get())
                .takenAt(clock.instant())
                .build();
    }

    /**
     * Stops accepting events and returns the retry queue as it stands. No final submissions
     * are attempted.
     */
    public List<RetryItem> shutdown() {
        if (accepting.compareAndSet(true, false)) {
            log.info("Mirror engine no longer accepting events");
        }
        return retryCoordinator.shutdown();
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    public EngineStatistics.Snapshot getStatistics() {
        return statistics.snapshot();
    }
}
