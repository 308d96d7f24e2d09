package com.mirrortrader.broker;

import com.mirrortrader.domain.enums.OrderSide;
import com.mirrortrader.exception.SubmissionException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Order placement at the execution venue.
 *
 * <p>Both calls block until the venue answers. Failures are reported as
 * {@link SubmissionException} with kind NETWORK, TIMEOUT or REJECTED.
 */
public interface ExecutionClient {

    /**
     * Places a limit order.
     *
     * @return the venue-assigned order id
     * @throws SubmissionException if the venue could not be reached or refused the order
     */
    long submitOrder(String market, OrderSide side, BigDecimal price, BigDecimal size, String clientOrderId);

    /**
     * Cancels live orders in one market.
     *
     * @throws SubmissionException if the venue could not be reached or refused the cancel
     */
    void cancelOrders(String market, List<Long> orderIds);
}
