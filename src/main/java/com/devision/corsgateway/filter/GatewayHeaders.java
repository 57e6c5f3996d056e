package com.devision.corsgateway.filter;

/**
 * Header names used by the gateway filters.
 */
public final class GatewayHeaders {

    public static final String API_KEY = "X-API-Key";
    public static final String CLIENT_DOMAIN = "X-Client-Domain";

    public static final String GATEWAY_ORIGIN = "X-Gateway-Origin";
    public static final String GATEWAY_API_KEY = "X-Gateway-API-Key";
    public static final String GATEWAY_CLIENT_DOMAIN = "X-Gateway-Client-Domain";

    public static final String REQUEST_ID = "X-Gateway-Request-ID";
    public static final String DURATION = "X-Gateway-Duration";
    public static final String PROXIED_FROM = "X-Proxied-From";

    public static final String RATE_LIMIT_LIMIT = "X-RateLimit-Limit";
    public static final String RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
    public static final String RATE_LIMIT_RESET = "X-RateLimit-Reset";

    private GatewayHeaders() {
    }
}
