package com.devision.corsgateway.controller;

import com.devision.corsgateway.template.CallerInfo;
import com.devision.corsgateway.template.InvocationContext;
import com.devision.corsgateway.template.InvocationErrorKind;
import com.devision.corsgateway.template.InvocationResult;
import com.devision.corsgateway.template.TemplateDispatcher;
import com.devision.corsgateway.template.TemplateListing;
import com.devision.corsgateway.template.TemplateValidator;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Invokes request templates on behalf of front-end applications.
 *
 * The response body is always the {@link InvocationResult}; the HTTP status reflects its outcome.
 */
@RestController
@RequestMapping("/gateway/templates")
public class TemplateController {

    private static final String API_KEY_HEADER = "X-API-Key";

    private final TemplateDispatcher dispatcher;
    private final TemplateValidator validator;

    public TemplateController(TemplateDispatcher dispatcher, TemplateValidator validator) {
        this.dispatcher = dispatcher;
        this.validator = validator;
    }

    @GetMapping
    public Mono<TemplateListing> listTemplates() {
        return Mono.fromSupplier(validator::listing);
    }

    @PostMapping("/{name}/invoke")
    public Mono<ResponseEntity<InvocationResult>> invoke(
            @PathVariable("name") String name,
            @RequestHeader(name = HttpHeaders.ORIGIN, required = false) String origin,
            @RequestHeader(name = API_KEY_HEADER, required = false) String apiKey,
            @RequestBody(required = false) TemplateInvocationRequest request
    ) {
        JsonNode context = request != null ? request.context() : null;
        JsonNode body = request != null ? request.body() : null;

        return dispatcher.invoke(name, InvocationContext.of(context), body, new CallerInfo(origin, apiKey))
                .map(result -> ResponseEntity.status(statusFor(result)).body(result));
    }

    static HttpStatus statusFor(InvocationResult result) {
        if (result.success()) {
            return HttpStatus.OK;
        }
        InvocationErrorKind kind = result.errorKind();
        if (kind == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (kind) {
            case TEMPLATE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case TEMPLATE_NOT_DECLARED -> HttpStatus.FORBIDDEN;
            case TEMPLATE_MALFORMED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSPORT_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
    }

    /**
     * @param context values for the template placeholders
     * @param body    optional request body; text is sent as-is, anything else as JSON
     */
    public record TemplateInvocationRequest(JsonNode context, JsonNode body) {
    }
}
