package com.mirrortrader.exception;

import com.mirrortrader.domain.enums.SubmissionErrorKind;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Failure reported by the execution venue for a submit or cancel call.
 *
 * <p>The kind says whether the venue was reached at all (NETWORK, TIMEOUT) or answered
 * with a rejection (REJECTED); reasonCode carries the venue's rejection code when there is one.
 */
@Getter
public class SubmissionException extends BaseException {

    private final SubmissionErrorKind kind;
    private final String reasonCode;

    public SubmissionException(SubmissionErrorKind kind, String reasonCode, String message) {
        super(ErrorCode.BROKER_ERROR, message, details(kind, reasonCode));
        this.kind = kind;
        this.reasonCode = reasonCode;
    }

    public SubmissionException(SubmissionErrorKind kind, String reasonCode, String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, details(kind, reasonCode), cause);
        this.kind = kind;
        this.reasonCode = reasonCode;
    }

    public static SubmissionException network(String message, Throwable cause) {
        return new SubmissionException(SubmissionErrorKind.NETWORK, null, message, cause);
    }

    public static SubmissionException timeout(String message) {
        return new SubmissionException(SubmissionErrorKind.TIMEOUT, null, message);
    }

    public static SubmissionException rejected(String reasonCode, String message) {
        return new SubmissionException(SubmissionErrorKind.REJECTED, reasonCode, message);
    }

    /** Short description used in logs and dead-letter records, e.g. "REJECTED(INSUFFICIENT_BALANCE): ...". */
    public String describe() {
        String prefix = reasonCode != null ? kind + "(" + reasonCode + ")" : kind.name();
        return prefix + ": " + getMessage();
    }

    private static Map<String, Object> details(SubmissionErrorKind kind, String reasonCode) {
        Map<String, Object> details = new HashMap<>();
        details.put("kind", kind.name());
        if (reasonCode != null) {
            details.put("reasonCode", reasonCode);
        }
        return details;
    }
}
