package com.mirrortrader.risk;

import java.util.Optional;
import lombok.Getter;

/**
 * Outcome of validating a mirror action: accepted, or rejected by the first check that failed.
 *
 * <p>Checks short-circuit, so a rejection carries exactly one violation and its reason is
 * deterministic for a given input.
 */
@Getter
public class RiskValidationResult {

    private static final RiskValidationResult ACCEPTED = new RiskValidationResult(null);

    private final RiskViolation violation;

    private RiskValidationResult(RiskViolation violation) {
        this.violation = violation;
    }

    public static RiskValidationResult accepted() {
        return ACCEPTED;
    }

    public static RiskValidationResult rejected(RiskViolation violation) {
        return new RiskValidationResult(violation);
    }

    public boolean isAccepted() {
        return violation == null;
    }

    public boolean isRejected() {
        return violation != null;
    }

    /** Human-readable rejection reason, empty when accepted. */
    public Optional<String> reason() {
        return Optional.ofNullable(violation).map(RiskViolation::getMessage);
    }
}
