package com.devision.corsgateway.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Declarative description of an outbound HTTP call.
 *
 * The path, header values and query values may contain {@code <%= dotted.path %>} placeholders.
 * Instances are immutable; the header and query maps keep their declaration order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestTemplate(
        String name,
        String method,
        String protocol,
        String host,
        String path,
        Map<String, String> headers,
        Map<String, String> query
) {

    public RequestTemplate {
        path = path == null ? "" : path;
        headers = copy(headers);
        query = query == null ? null : copy(query);
    }

    public RequestTemplate withName(String templateName) {
        return new RequestTemplate(templateName, method, protocol, host, path, headers, query);
    }

    private static Map<String, String> copy(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
