package com.devision.corsgateway.template;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlaceholderParserTest {

    @Test
    void splitsLiteralsAndPlaceholders() {
        List<TemplateSegment> segments = PlaceholderParser.parse("/users/<%= user.id %>/posts");

        assertThat(segments).containsExactly(
                new TemplateSegment.Literal("/users/"),
                new TemplateSegment.Placeholder("<%= user.id %>", "user.id"),
                new TemplateSegment.Literal("/posts"));
    }

    @Test
    void placeholderPathSplitsOnDots() {
        TemplateSegment.Placeholder placeholder = new TemplateSegment.Placeholder("<%= a.b.0 %>", "a.b.0");

        assertThat(placeholder.path()).containsExactly("a", "b", "0");
    }

    @Test
    void unterminatedMarkerIsLiteral() {
        List<TemplateSegment> segments = PlaceholderParser.parse("Bearer <%= token");

        assertThat(segments).containsExactly(new TemplateSegment.Literal("Bearer <%= token"));
        assertThat(PlaceholderParser.containsPlaceholder("Bearer <%= token")).isFalse();
    }

    @Test
    void adjacentPlaceholders() {
        List<TemplateSegment> segments = PlaceholderParser.parse("<%=a%><%= b %>");

        assertThat(segments).extracting(TemplateSegment::source).containsExactly("<%=a%>", "<%= b %>");
        assertThat(PlaceholderParser.containsPlaceholder("<%=a%>")).isTrue();
    }

    @Test
    void emptyAndNullInputsHaveNoSegments() {
        assertThat(PlaceholderParser.parse("")).isEmpty();
        assertThat(PlaceholderParser.parse(null)).isEmpty();
    }
}
