package com.devision.corsgateway.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a template string into literal and placeholder segments.
 *
 * A placeholder starts with {@code <%=} and ends at the next {@code %>}. An opening marker
 * without a closing one is kept as literal text.
 */
public final class PlaceholderParser {

    static final String OPEN = "<%=";
    static final String CLOSE = "%>";

    private PlaceholderParser() {
    }

    public static List<TemplateSegment> parse(String input) {
        List<TemplateSegment> segments = new ArrayList<>();
        if (input == null || input.isEmpty()) {
            return segments;
        }

        int cursor = 0;
        while (cursor < input.length()) {
            int open = input.indexOf(OPEN, cursor);
            if (open < 0) {
                break;
            }
            int close = input.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                break;
            }
            if (open > cursor) {
                segments.add(new TemplateSegment.Literal(input.substring(cursor, open)));
            }
            int end = close + CLOSE.length();
            String expression = input.substring(open + OPEN.length(), close).trim();
            segments.add(new TemplateSegment.Placeholder(input.substring(open, end), expression));
            cursor = end;
        }

        if (cursor < input.length()) {
            segments.add(new TemplateSegment.Literal(input.substring(cursor)));
        }
        return segments;
    }

    public static boolean containsPlaceholder(String input) {
        return parse(input).stream().anyMatch(TemplateSegment.Placeholder.class::isInstance);
    }
}
