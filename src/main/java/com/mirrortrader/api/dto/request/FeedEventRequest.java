package com.mirrortrader.api.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Request DTO for injecting one raw feed event, e.g. when replaying a captured payload or
 * when no live feed source is wired.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class FeedEventRequest {

    @NotBlank(message = "market is required")
    private String market;

    @NotBlank(message = "eventType is required")
    private String eventType;

    @NotNull(message = "payload is required")
    private JsonNode payload;
}
