package com.mirrortrader.unit.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mirrortrader.api.controller.MirrorController;
import com.mirrortrader.config.ApiResponseAdvice;
import com.mirrortrader.core.engine.EngineStatistics;
import com.mirrortrader.core.engine.MirrorEngine;
import com.mirrortrader.core.engine.MirrorSnapshot;
import com.mirrortrader.domain.enums.CircuitState;
import com.mirrortrader.domain.enums.OrderSide;
import com.mirrortrader.domain.enums.OrderStatus;
import com.mirrortrader.domain.model.MirrorAction;
import com.mirrortrader.domain.model.Order;
import com.mirrortrader.exception.GlobalExceptionHandler;
import com.mirrortrader.feed.MarketEventDispatcher;
import com.mirrortrader.oms.OrderTracker;
import com.mirrortrader.retry.DeadLetterLog;
import com.mirrortrader.retry.DeadLetterRecord;
import com.mirrortrader.retry.RetryCoordinator;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for MirrorController, including the response envelope and error
 * mapping applied by ApiResponseAdvice and GlobalExceptionHandler.
 */
@ExtendWith(MockitoExtension.class)
class MirrorControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private MockMvc mockMvc;

    @Mock
    private MirrorEngine mirrorEngine;

    @Mock
    private MarketEventDispatcher dispatcher;

    @Mock
    private OrderTracker orderTracker;

    @Mock
    private RetryCoordinator retryCoordinator;

    @Mock
    private DeadLetterLog deadLetterLog;

    @Mock
    private Clock clock;

    @InjectMocks
    private MirrorController mirrorController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(mirrorController)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/mirror/snapshot returns the engine snapshot in the success envelope")
    void getSnapshot() throws Exception {
        when(mirrorEngine.snapshot()).thenReturn(MirrorSnapshot.builder()
                .positions(List.of())
                .openOrders(List.of())
                .circuitState(CircuitState.HALF_OPEN)
                .retryQueueDepth(2)
                .deadLetterCount(1)
                .totalExposure(new BigDecimal("1250"))
                .fillRate(new BigDecimal("0.5"))
                .statistics(new EngineStatistics().snapshot())
                .accepting(true)
                .takenAt(NOW)
                .build());

        mockMvc.perform(get("/api/mirror/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.circuitState").value("HALF_OPEN"))
                .andExpect(jsonPath("$.data.retryQueueDepth").value(2))
                .andExpect(jsonPath("$.data.totalExposure").value(1250));
    }

    @Test
    @DisplayName("GET /api/mirror/orders/{id} returns the tracked order")
    void getOrder_found() throws Exception {
        when(orderTracker.find("cid-1")).thenReturn(Optional.of(Order.builder()
                .orderId(501L)
                .clientOrderId("cid-1")
                .sourceOrderId(12L)
                .market("0xmarket-a")
                .side(OrderSide.BUY)
                .price(new BigDecimal("50"))
                .size(new BigDecimal("10"))
                .remainingSize(new BigDecimal("6"))
                .status(OrderStatus.PARTIALLY_FILLED)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build()));

        mockMvc.perform(get("/api/mirror/orders/cid-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.orderId").value(501))
                .andExpect(jsonPath("$.data.status").value("PARTIALLY_FILLED"))
                .andExpect(jsonPath("$.data.filledSize").value(4));
    }

    @Test
    @DisplayName("GET /api/mirror/orders/{id} for an unknown order returns 404")
    void getOrder_notFound() throws Exception {
        when(orderTracker.find("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/mirror/orders/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /api/mirror/dead-letters lists dead-lettered actions")
    void getDeadLetters() throws Exception {
        MirrorAction action = MirrorAction.builder()
                .clientOrderId("cid-9")
                .market("0xmarket-a")
                .sourceOrderId(9L)
                .side(OrderSide.SELL)
                .price(new BigDecimal("1"))
                .size(new BigDecimal("3"))
                .build();
        when(deadLetterLog.records()).thenReturn(List.of(new DeadLetterRecord(action, 4, "TIMEOUT: slow", NOW)));

        mockMvc.perform(get("/api/mirror/dead-letters"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].action.clientOrderId").value("cid-9"))
                .andExpect(jsonPath("$.data[0].attempts").value(4));
    }

    @Test
    @DisplayName("GET /api/mirror/retries lists queued submissions")
    void getRetries() throws Exception {
        when(retryCoordinator.pendingItems()).thenReturn(List.of());

        mockMvc.perform(get("/api/mirror/retries"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    @DisplayName("POST /api/mirror/events queues the event on the dispatcher")
    void postEvent_dispatched() throws Exception {
        when(mirrorEngine.isAccepting()).thenReturn(true);
        when(clock.instant()).thenReturn(NOW);

        mockMvc.perform(post("/api/mirror/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market": "0xmarket-a", "eventType": "Trade",
                                 "payload": {"orderid": 501, "filledsize": "1", "price": "0.5", "blocknumber": 7}}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.queued").value(true))
                .andExpect(jsonPath("$.data.eventType").value("Trade"));

        verify(dispatcher)
                .dispatch(argThat(raw -> raw.market().equals("0xmarket-a")
                        && raw.payload().path("orderid").asLong() == 501L
                        && raw.receivedAt().equals(NOW)));
    }

    @Test
    @DisplayName("POST /api/mirror/events without a market is a validation error")
    void postEvent_missingMarket() throws Exception {
        mockMvc.perform(post("/api/mirror/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"eventType": "Trade", "payload": {}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.market").value("market is required"));

        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    @DisplayName("POST /api/mirror/events after shutdown returns 503")
    void postEvent_afterShutdown() throws Exception {
        when(mirrorEngine.isAccepting()).thenReturn(false);

        mockMvc.perform(post("/api/mirror/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market": "0xmarket-a", "eventType": "Trade", "payload": {}}
                                """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("SERVICE_UNAVAILABLE"));

        verify(dispatcher, never()).dispatch(any());
    }
}
