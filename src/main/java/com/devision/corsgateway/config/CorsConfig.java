package com.devision.corsgateway.config;

import com.devision.corsgateway.cors.DynamicCorsConfigurationSource;
import com.devision.corsgateway.cors.GatewayCorsWebFilter;
import com.devision.corsgateway.cors.OriginPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * CORS Configuration for the gateway
 *
 * Unlike the backend, which only trusts one origin, the gateway decides per request:
 * configured origins, domain patterns and domains registered at runtime with an API key
 * are all accepted. Everything else gets 403 with a JSON "CORS Error" body.
 */
@Configuration
public class CorsConfig {

    @Bean
    public DynamicCorsConfigurationSource corsConfigurationSource(OriginPolicy originPolicy) {
        return new DynamicCorsConfigurationSource(originPolicy);
    }

    @Bean
    public GatewayCorsWebFilter corsWebFilter(DynamicCorsConfigurationSource corsConfigurationSource,
                                              ObjectMapper objectMapper) {
        return new GatewayCorsWebFilter(corsConfigurationSource, objectMapper);
    }
}
