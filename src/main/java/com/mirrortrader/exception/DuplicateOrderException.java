package com.mirrortrader.exception;

import java.util.Map;

public class DuplicateOrderException extends BaseException {

    public DuplicateOrderException(String clientOrderId) {
        super(
                ErrorCode.CONFLICT,
                "Order already registered with clientOrderId: " + clientOrderId,
                Map.of("clientOrderId", clientOrderId));
    }
}
