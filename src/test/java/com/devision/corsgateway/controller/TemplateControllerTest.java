package com.devision.corsgateway.controller;

import com.devision.corsgateway.template.CallerInfo;
import com.devision.corsgateway.template.InvocationContext;
import com.devision.corsgateway.template.InvocationErrorKind;
import com.devision.corsgateway.template.InvocationResult;
import com.devision.corsgateway.template.TemplateDispatcher;
import com.devision.corsgateway.template.TemplateListing;
import com.devision.corsgateway.template.TemplateValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TemplateControllerTest {

    private TemplateDispatcher dispatcher;
    private TemplateValidator validator;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        dispatcher = mock(TemplateDispatcher.class);
        validator = mock(TemplateValidator.class);
        client = WebTestClient.bindToController(new TemplateController(dispatcher, validator)).build();
    }

    private void dispatcherReturns(InvocationResult result) {
        when(dispatcher.invoke(anyString(), any(InvocationContext.class), any(), any(CallerInfo.class)))
                .thenReturn(Mono.just(result));
    }

    @Test
    void listsTemplates() {
        when(validator.listing()).thenReturn(new TemplateListing(
                List.of("createTicket", "getTest"), List.of("getTest"), List.of("getTest")));

        client.get().uri("/gateway/templates")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.configured.length()").isEqualTo(2)
                .jsonPath("$.valid[0]").isEqualTo("getTest");
    }

    @Test
    void successfulInvocationIs200AndPassesCallerAndContext() {
        dispatcherReturns(InvocationResult.success(201, Map.of(),
                JsonNodeFactory.instance.objectNode().put("id", 1), 12));

        client.post().uri("/gateway/templates/createTicket/invoke")
                .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                .header("X-API-Key", "development-key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"context\":{\"apiKey\":\"k1\"},\"body\":{\"title\":\"T\"}}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.status").isEqualTo(201)
                .jsonPath("$.data.id").isEqualTo(1)
                .jsonPath("$.errorKind").doesNotExist();

        ArgumentCaptor<InvocationContext> context = ArgumentCaptor.forClass(InvocationContext.class);
        ArgumentCaptor<Object> body = ArgumentCaptor.forClass(Object.class);
        verify(dispatcher).invoke(eq("createTicket"), context.capture(), body.capture(),
                eq(new CallerInfo("http://localhost:3000", "development-key-1")));
        assertThat(context.getValue().resolve(List.of("context", "apiKey"))).contains("k1");
        assertThat(((JsonNode) body.getValue()).get("title").asText()).isEqualTo("T");
    }

    @Test
    void invocationWithoutBodyUsesEmptyContext() {
        dispatcherReturns(InvocationResult.success(200, Map.of(), null, 3));

        client.post().uri("/gateway/templates/getTest/invoke")
                .exchange()
                .expectStatus().isOk();

        verify(dispatcher).invoke(eq("getTest"), any(InvocationContext.class), eq(null),
                eq(new CallerInfo(null, null)));
    }

    @Test
    void mapsFailureKindsToStatuses() {
        dispatcherReturns(InvocationResult.failure(InvocationErrorKind.TEMPLATE_NOT_FOUND,
                "Template \"ghost\" not found in request templates", 0));

        client.post().uri("/gateway/templates/ghost/invoke")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.errorKind").isEqualTo("TEMPLATE_NOT_FOUND")
                .jsonPath("$.status").doesNotExist();
    }

    @Test
    void statusForEachKind() {
        assertThat(TemplateController.statusFor(InvocationResult.failure(InvocationErrorKind.TEMPLATE_NOT_DECLARED, "x", 0)).value())
                .isEqualTo(403);
        assertThat(TemplateController.statusFor(InvocationResult.failure(InvocationErrorKind.TEMPLATE_MALFORMED, "x", 0)).value())
                .isEqualTo(422);
        assertThat(TemplateController.statusFor(InvocationResult.failure(InvocationErrorKind.TRANSPORT_FAILURE, "x", 0)).value())
                .isEqualTo(502);
        assertThat(TemplateController.statusFor(InvocationResult.success(500, Map.of(), null, 0)).value())
                .isEqualTo(200);
    }
}
