package com.devision.corsgateway.template;

/**
 * Who asked for an invocation; recorded in the request log only.
 */
public record CallerInfo(String origin, String apiKey) {

    public static final CallerInfo ANONYMOUS = new CallerInfo(null, null);
}
