package com.devision.corsgateway.template;

public enum InvocationErrorKind {
    TEMPLATE_NOT_FOUND,
    TEMPLATE_NOT_DECLARED,
    TEMPLATE_MALFORMED,
    TRANSPORT_FAILURE
}
