package com.devision.corsgateway.template;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fills {@code <%= ... %>} placeholders in a template's path, header values and query values.
 *
 * A placeholder that cannot be resolved is left exactly as written. The input template is never
 * modified; a new {@link RequestTemplate} is returned.
 */
@Slf4j
public class TemplateProcessor {

    public RequestTemplate render(RequestTemplate template, InvocationContext context) {
        InvocationContext ctx = context == null ? InvocationContext.empty() : context;
        return new RequestTemplate(
                template.name(),
                template.method(),
                template.protocol(),
                template.host(),
                renderString(template.path(), ctx),
                renderMap(template.headers(), ctx),
                template.query() == null ? null : renderMap(template.query(), ctx));
    }

    public String renderString(String input, InvocationContext context) {
        if (input == null || input.isEmpty()) {
            return input;
        }
        StringBuilder out = new StringBuilder(input.length());
        for (TemplateSegment segment : PlaceholderParser.parse(input)) {
            if (segment instanceof TemplateSegment.Placeholder placeholder) {
                out.append(resolve(placeholder, context));
            } else {
                out.append(segment.source());
            }
        }
        return out.toString();
    }

    private String resolve(TemplateSegment.Placeholder placeholder, InvocationContext context) {
        return context.resolve(placeholder.path()).orElseGet(() -> {
            log.warn("Template variable \"{}\" not found in context", placeholder.expression());
            return placeholder.source();
        });
    }

    private Map<String, String> renderMap(Map<String, String> values, InvocationContext context) {
        Map<String, String> rendered = new LinkedHashMap<>();
        values.forEach((key, value) -> rendered.put(key, renderString(value, context)));
        return rendered;
    }
}
