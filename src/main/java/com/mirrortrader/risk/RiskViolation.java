package com.mirrortrader.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single failed risk check.
 *
 * <p>The code is machine-readable (EXPOSURE_LIMIT_EXCEEDED, INSUFFICIENT_BALANCE, ...); the
 * message is the human-readable reason with the concrete figures that failed, for example
 * "exposure limit exceeded: would reach 5500/5000".
 */
@Getter
@Builder
public class RiskViolation {

    private final String code;
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
