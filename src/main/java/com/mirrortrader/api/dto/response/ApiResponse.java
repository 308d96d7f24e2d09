package com.mirrortrader.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope applied to every REST body by
 * {@link com.mirrortrader.config.ApiResponseAdvice}: {@code {"success": true, "data": ..., "timestamp": ...}}.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data, Instant timestamp) {
        this.data = data;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, Instant.now());
    }
}
