package com.mirrortrader.broker;

import com.mirrortrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dry-run venue: accepts every order, assigns sequential ids and logs what would have been
 * sent. Used when no real execution client is configured.
 */
public class PaperExecutionClient implements ExecutionClient {

    private static final Logger log = LoggerFactory.getLogger(PaperExecutionClient.class);

    private final AtomicLong nextOrderId = new AtomicLong(1);

    @Override
    public long submitOrder(String market, OrderSide side, BigDecimal price, BigDecimal size, String clientOrderId) {
        long orderId = nextOrderId.getAndIncrement();
        log.info(
                "[DRY RUN] Order placed: orderId={}, clientOrderId={}, market={}, side={}, size={}, price={}",
                orderId,
                clientOrderId,
                market,
                side,
                size.toPlainString(),
                price.toPlainString());
        return orderId;
    }

    @Override
    public void cancelOrders(String market, List<Long> orderIds) {
        log.info("[DRY RUN] Orders canceled: market={}, orderIds={}", market, orderIds);
    }
}
