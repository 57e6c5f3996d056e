package com.devision.corsgateway.template;

import java.util.Arrays;
import java.util.List;

/**
 * One piece of a parsed template string: either literal text or a {@code <%= ... %>} placeholder.
 */
public interface TemplateSegment {

    /**
     * Text exactly as it appeared in the template.
     */
    String source();

    record Literal(String source) implements TemplateSegment {
    }

    /**
     * @param source     full marker text, e.g. {@code <%= context.userId %>}
     * @param expression trimmed expression between the markers
     */
    record Placeholder(String source, String expression) implements TemplateSegment {

        public List<String> path() {
            return Arrays.asList(expression.split("\\.", -1));
        }
    }
}
