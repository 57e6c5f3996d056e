package com.devision.corsgateway.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InvocationContextTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void resolvesNestedMembersAndArrayIndexes() throws Exception {
        InvocationContext context = InvocationContext.of(objectMapper.readTree(
                "{\"user\":{\"id\":42,\"tags\":[\"a\",\"b\"]},\"flag\":true}"));

        assertThat(context.resolve(List.of("user", "id"))).contains("42");
        assertThat(context.resolve(List.of("user", "tags", "1"))).contains("b");
        assertThat(context.resolve(List.of("flag"))).contains("true");
    }

    @Test
    void containersRenderAsJson() {
        InvocationContext context = InvocationContext.of(Map.of("user", Map.of("id", 7)));

        assertThat(context.resolve(List.of("user"))).contains("{\"id\":7}");
    }

    @Test
    void contextPrefixAddressesRoot() {
        InvocationContext context = InvocationContext.of(Map.of("apiKey", "k1"));

        assertThat(context.resolve(List.of("context", "apiKey"))).contains("k1");
        assertThat(context.resolve(List.of("apiKey"))).contains("k1");
    }

    @Test
    void explicitContextMemberWins() {
        InvocationContext context = InvocationContext.of(Map.of(
                "apiKey", "outer",
                "context", Map.of("apiKey", "inner")));

        assertThat(context.resolve(List.of("context", "apiKey"))).contains("inner");
    }

    @Test
    void missingStepsResolveEmpty() {
        InvocationContext context = InvocationContext.of(Map.of("user", Map.of("id", 7)));

        assertThat(context.resolve(List.of("user", "name"))).isEmpty();
        assertThat(context.resolve(List.of("user", "id", "x"))).isEmpty();
        assertThat(context.resolve(List.of())).isEmpty();
        assertThat(InvocationContext.empty().resolve(List.of("anything"))).isEmpty();
    }

    @Test
    void nullTreeIsEmpty() {
        assertThat(InvocationContext.of((JsonNode) null).root().size()).isZero();
    }
}
