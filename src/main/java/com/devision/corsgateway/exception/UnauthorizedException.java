package com.devision.corsgateway.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when a proxied request fails API key authentication
 */
@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class UnauthorizedException extends RuntimeException {

    private final String error;
    private final String origin;

    public UnauthorizedException(String error, String message, String origin) {
        super(message);
        this.error = error;
        this.origin = origin;
    }

    /**
     * Short title, e.g. "Invalid API Key".
     */
    public String getError() {
        return error;
    }

    public String getOrigin() {
        return origin;
    }
}
