package com.mirrortrader.api.controller;

import com.mirrortrader.api.dto.request.FeedEventRequest;
import com.mirrortrader.core.engine.MirrorEngine;
import com.mirrortrader.core.engine.MirrorSnapshot;
import com.mirrortrader.domain.model.Order;
import com.mirrortrader.exception.EngineShutdownException;
import com.mirrortrader.exception.ResourceNotFoundException;
import com.mirrortrader.feed.MarketEventDispatcher;
import com.mirrortrader.feed.RawFeedEvent;
import com.mirrortrader.oms.OrderTracker;
import com.mirrortrader.retry.DeadLetterLog;
import com.mirrortrader.retry.DeadLetterRecord;
import com.mirrortrader.retry.RetryCoordinator;
import com.mirrortrader.retry.RetryItem;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Status and injection endpoints for the mirror engine.
 *
 * <ul>
 *   <li>GET /api/mirror/snapshot: positions, open orders, circuit state, statistics</li>
 *   <li>GET /api/mirror/orders/{clientOrderId}: one tracked order</li>
 *   <li>GET /api/mirror/retries: submissions waiting for retry</li>
 *   <li>GET /api/mirror/dead-letters: submissions given up on</li>
 *   <li>POST /api/mirror/events: queue one raw feed event on its market's worker</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/mirror")
public class MirrorController {

    private final MirrorEngine mirrorEngine;
    private final MarketEventDispatcher dispatcher;
    private final OrderTracker orderTracker;
    private final RetryCoordinator retryCoordinator;
    private final DeadLetterLog deadLetterLog;
    private final Clock clock;

    public MirrorController(
            MirrorEngine mirrorEngine,
            MarketEventDispatcher dispatcher,
            OrderTracker orderTracker,
            RetryCoordinator retryCoordinator,
            DeadLetterLog deadLetterLog,
            Clock clock) {
        this.mirrorEngine = mirrorEngine;
        this.dispatcher = dispatcher;
        this.orderTracker = orderTracker;
        this.retryCoordinator = retryCoordinator;
        this.deadLetterLog = deadLetterLog;
        this.clock = clock;
    }

    @GetMapping("/snapshot")
    public MirrorSnapshot getSnapshot() {
        return mirrorEngine.snapshot();
    }

    @GetMapping("/orders/{clientOrderId}")
    public Order getOrder(@PathVariable String clientOrderId) {
        return orderTracker
                .find(clientOrderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", clientOrderId));
    }

    @GetMapping("/retries")
    public List<RetryItem> getPendingRetries() {
        return retryCoordinator.pendingItems();
    }

    @GetMapping("/dead-letters")
    public List<DeadLetterRecord> getDeadLetters() {
        return deadLetterLog.records();
    }

    @PostMapping("/events")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> submitEvent(@Valid @RequestBody FeedEventRequest request) {
        if (!mirrorEngine.isAccepting()) {
            throw new EngineShutdownException();
        }
        RawFeedEvent rawEvent =
                new RawFeedEvent(request.getMarket(), request.getEventType(), request.getPayload(), clock.instant());
        dispatcher.dispatch(rawEvent);
        return Map.of("queued", true, "market", request.getMarket(), "eventType", request.getEventType());
    }
}
