package com.mirrortrader.retry;

import com.mirrortrader.config.MirrorConfig;
import com.mirrortrader.exception.SubmissionException;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Sorts venue failures into retriable and permanent.
 *
 * <p>Network and timeout failures are always retriable. A rejection is retriable only when
 * its reason code is one of the configured congestion codes (venue busy, rate limited);
 * every other rejection (bad parameters, insufficient funds at the venue) is permanent.
 */
@Component
public class SubmissionErrorClassifier {

    private final Set<String> retriableRejectCodes;

    public SubmissionErrorClassifier(MirrorConfig mirrorConfig) {
        this.retriableRejectCodes = mirrorConfig.getRetry().getRetriableRejectCodes().stream()
                .map(code -> code.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public FailureClass classify(SubmissionException exception) {
        return switch (exception.getKind()) {
            case NETWORK, TIMEOUT -> FailureClass.RETRIABLE;
            case REJECTED -> exception.getReasonCode() != null
                            && retriableRejectCodes.contains(exception.getReasonCode().toUpperCase(Locale.ROOT))
                    ? FailureClass.RETRIABLE
                    : FailureClass.PERMANENT;
        };
    }
}
