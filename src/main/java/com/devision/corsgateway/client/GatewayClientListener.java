package com.devision.corsgateway.client;

/**
 * Observer for calls made by {@link GatewayClient}. Called once per attempt.
 */
public interface GatewayClientListener {

    default void onRequest(String method, String url) {
    }

    default void onResponse(String method, String url, int status, long durationMs) {
    }

    default void onError(String method, String url, Throwable error) {
    }
}
