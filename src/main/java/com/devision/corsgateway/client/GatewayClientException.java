package com.devision.corsgateway.client;

import lombok.Getter;

/**
 * Failure reported by {@link GatewayClient}. {@code status} is null when no HTTP response was received.
 */
@Getter
public class GatewayClientException extends RuntimeException {

    private final Integer status;

    public GatewayClientException(Integer status, String message) {
        super(message);
        this.status = status;
    }

    public GatewayClientException(String message, Throwable cause) {
        super(message, cause);
        this.status = null;
    }

    public boolean isAuthFailure() {
        return status != null && (status == 401 || status == 403);
    }
}
