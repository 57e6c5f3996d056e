package com.devision.corsgateway.template;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Outcome of a template invocation.
 *
 * Any HTTP response from the upstream, including 4xx and 5xx, is a success carrying that status.
 * Failures are template errors or transport errors and carry no status.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvocationResult(
        boolean success,
        Integer status,
        Map<String, String> headers,
        JsonNode data,
        long duration,
        InvocationErrorKind errorKind,
        String error
) {

    public static InvocationResult success(int status, Map<String, String> headers, JsonNode data, long duration) {
        return new InvocationResult(true, status, headers == null ? Map.of() : Map.copyOf(headers),
                data, duration, null, null);
    }

    public static InvocationResult failure(InvocationErrorKind kind, String error, long duration) {
        return new InvocationResult(false, null, null, null, duration, kind, error);
    }
}
