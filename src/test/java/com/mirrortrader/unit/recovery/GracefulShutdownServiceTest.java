package com.mirrortrader.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import com.mirrortrader.core.engine.EngineStatistics;
import com.mirrortrader.core.engine.MirrorEngine;
import com.mirrortrader.feed.MarketEventDispatcher;
import com.mirrortrader.recovery.GracefulShutdownService;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GracefulShutdownServiceTest {

    @Mock
    private MarketEventDispatcher dispatcher;

    @Mock
    private MirrorEngine mirrorEngine;

    private GracefulShutdownService gracefulShutdownService;

    @BeforeEach
    void setUp() {
        gracefulShutdownService = new GracefulShutdownService(dispatcher, mirrorEngine);
    }

    @Test
    @DisplayName("Stop drains the market workers before stopping the engine")
    void stop_drainsThenStopsEngine() {
        when(mirrorEngine.shutdown()).thenReturn(List.of());
        when(mirrorEngine.getStatistics()).thenReturn(new EngineStatistics().snapshot());
        gracefulShutdownService.start();

        gracefulShutdownService.stop();

        InOrder order = inOrder(dispatcher, mirrorEngine);
        order.verify(dispatcher).shutdown(any(Duration.class));
        order.verify(mirrorEngine).shutdown();
        assertThat(gracefulShutdownService.isRunning()).isFalse();
    }

    @Test
    @DisplayName("A failure while draining is logged and the service still stops")
    void stop_failureStillStops() {
        doThrow(new IllegalStateException("stuck")).when(dispatcher).shutdown(any(Duration.class));
        gracefulShutdownService.start();

        gracefulShutdownService.stop();

        assertThat(gracefulShutdownService.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Stops right after the feed subscription, ahead of other components")
    void phase() {
        assertThat(gracefulShutdownService.getPhase()).isEqualTo(Integer.MAX_VALUE - 1);
    }
}
