package com.devision.corsgateway.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(GatewayProperties properties) {
        return new OpenAPI()
                .info(new Info()
                        .title("CORS Gateway")
                        .version(properties.getVersion())
                        .description("""
                                Gateway that lets browser applications reach a backend which only trusts a single origin.

                                ## Access

                                Configured and pattern-matched origins need no credentials.
                                Any other origin must send `X-API-Key: <your-api-key>`; the origin is then registered
                                and accepted by the CORS policy from then on.

                                ## Endpoints

                                - `ALL /api/**` - proxied to the backend
                                - `POST /gateway/templates/{name}/invoke` - invoke a declared request template
                                - `GET /gateway/stats`, `GET /gateway/logs` - request statistics
                                - `POST /gateway/register-domain` - register an origin with an API key
                                """)
                        .contact(new Contact()
                                .name("DevVision Team")
                                .email("support@devision.com")))
                .servers(List.of(
                        new Server()
                                .url(properties.getGatewayUrl())
                                .description(properties.getEnvironment())))
                .components(new Components()
                        .addSecuritySchemes("apiKeyAuth", new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-API-Key")
                                .description("Gateway API key, required for origins that are not pre-configured")))
                .addSecurityItem(new SecurityRequirement().addList("apiKeyAuth"));
    }
}
