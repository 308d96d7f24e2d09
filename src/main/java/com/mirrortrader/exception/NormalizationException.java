package com.mirrortrader.exception;

import java.util.Map;

/**
 * A raw feed payload could not be turned into a domain event: a required field was
 * missing or had the wrong type. The raw payload travels in the details so the caller
 * can log it.
 */
public class NormalizationException extends BaseException {

    public NormalizationException(String eventType, String message, String rawPayload) {
        super(
                ErrorCode.VALIDATION_ERROR,
                String.format("Malformed %s event: %s", eventType, message),
                Map.of("eventType", String.valueOf(eventType), "payload", String.valueOf(rawPayload)));
    }

    public String getRawPayload() {
        return String.valueOf(getDetails().get("payload"));
    }
}
