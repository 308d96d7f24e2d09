package com.mirrortrader.exception;

/** Raised when an event is pushed into the engine after shutdown began. */
public class EngineShutdownException extends BaseException {

    public EngineShutdownException() {
        super(ErrorCode.SERVICE_UNAVAILABLE, "Mirror engine is shutting down and no longer accepts events");
    }
}
