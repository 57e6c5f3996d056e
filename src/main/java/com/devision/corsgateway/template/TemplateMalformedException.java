package com.devision.corsgateway.template;

/**
 * Thrown when a template lacks a field needed to build the request.
 */
public class TemplateMalformedException extends TemplateException {

    public TemplateMalformedException(String templateName, String message) {
        super(templateName, message);
    }

    public static TemplateMalformedException missingField(String templateName, String field) {
        return new TemplateMalformedException(templateName,
                "Template \"" + templateName + "\" missing required field: " + field);
    }

    @Override
    public InvocationErrorKind getKind() {
        return InvocationErrorKind.TEMPLATE_MALFORMED;
    }
}
