package com.devision.corsgateway.config;

import com.devision.corsgateway.requestlog.RequestLog;
import com.devision.corsgateway.template.PermissionRegistry;
import com.devision.corsgateway.template.TemplateDispatcher;
import com.devision.corsgateway.template.TemplateProcessor;
import com.devision.corsgateway.template.TemplateStore;
import com.devision.corsgateway.template.TemplateValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Wires the template proxy: store and permissions are loaded once here and handed to the
 * components that need them.
 */
@Configuration
public class TemplateConfig {

    @Bean
    public Clock gatewayClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RequestLog requestLog(GatewayProperties properties, Clock gatewayClock) {
        return new RequestLog(properties.getLogs().getCapacity(), gatewayClock);
    }

    @Bean
    public TemplateStore templateStore(ObjectMapper objectMapper, ResourceLoader resourceLoader,
                                       GatewayProperties properties) {
        TemplateStore store = new TemplateStore(objectMapper,
                resourceLoader.getResource(properties.getTemplates().getLocation()));
        store.load();
        return store;
    }

    @Bean
    public PermissionRegistry permissionRegistry(ObjectMapper objectMapper, ResourceLoader resourceLoader,
                                                 GatewayProperties properties) {
        PermissionRegistry registry = new PermissionRegistry(objectMapper, resourceLoader,
                properties.getTemplates().getManifestLocation());
        registry.load(properties.getTemplates().getApplicationId());
        return registry;
    }

    @Bean
    public TemplateValidator templateValidator(TemplateStore templateStore, PermissionRegistry permissionRegistry) {
        return new TemplateValidator(templateStore, permissionRegistry);
    }

    @Bean
    public TemplateProcessor templateProcessor() {
        return new TemplateProcessor();
    }

    @Bean
    public TemplateDispatcher templateDispatcher(TemplateValidator templateValidator,
                                                 TemplateProcessor templateProcessor,
                                                 WebClient.Builder webClientBuilder,
                                                 RequestLog requestLog,
                                                 ObjectMapper objectMapper,
                                                 GatewayProperties properties,
                                                 Clock gatewayClock) {
        return new TemplateDispatcher(
                templateValidator,
                templateProcessor,
                webClientBuilder.build(),
                requestLog,
                objectMapper,
                properties.getTemplates().getTimeout(),
                gatewayClock);
    }
}
