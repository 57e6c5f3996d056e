package com.devision.corsgateway.requestlog;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One proxied or template-dispatched call.
 *
 * {@code status} is null when no response was received; {@code durationMs} may be null when the
 * call failed before timing was available.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntry(
        String requestId,
        String method,
        String path,
        String origin,
        String apiKey,
        Integer status,
        Long durationMs,
        Instant timestamp,
        String error
) {
}
