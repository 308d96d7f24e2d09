package com.mirrortrader.domain.enums;

/** State of the venue submission circuit breaker. */
public enum CircuitState {
    CLOSED(0),
    HALF_OPEN(1),
    OPEN(2);

    private final int gaugeValue;

    CircuitState(int gaugeValue) {
        this.gaugeValue = gaugeValue;
    }

    /** Numeric value exported on the circuit state gauge. */
    public int gaugeValue() {
        return gaugeValue;
    }
}
