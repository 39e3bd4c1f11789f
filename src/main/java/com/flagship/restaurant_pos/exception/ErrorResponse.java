package com.flagship.restaurant_pos.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Uniform error body returned by every endpoint.
 */
@Value
@Builder
public class ErrorResponse {
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
