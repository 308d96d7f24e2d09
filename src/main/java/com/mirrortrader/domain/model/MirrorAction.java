package com.mirrortrader.domain.model;

import com.mirrortrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A sized order the engine intends to place at the venue on behalf of a source order.
 * This is the payload risk validation inspects and the retry queue carries.
 */
@Value
@Builder
public class MirrorAction {

    String clientOrderId;
    String market;
    long sourceOrderId;
    OrderSide side;
    BigDecimal price;
    BigDecimal size;

    public BigDecimal getNotional() {
        return size.multiply(price);
    }

    /** Size signed by side, positive for BUY. */
    public BigDecimal getSignedSize() {
        return side.signed(size);
    }
}
