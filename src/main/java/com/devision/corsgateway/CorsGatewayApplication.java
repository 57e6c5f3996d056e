package com.devision.corsgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CORS Gateway Application
 *
 * Single entry point for browser applications whose origin the backend does not trust.
 * Handles:
 * - Dynamic CORS (configured origins, wildcard patterns, runtime-registered domains)
 * - API key authentication and rate limiting for proxied calls
 * - Transparent proxying of /api/** to the backend
 * - Template-based requests validated against the application manifest
 */
@SpringBootApplication
public class CorsGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(CorsGatewayApplication.class, args);
    }
}
