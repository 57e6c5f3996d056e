package com.devision.corsgateway.template;

public class TemplateNotDeclaredException extends TemplateException {

    public TemplateNotDeclaredException(String templateName) {
        super(templateName, "Template \"" + templateName + "\" not declared in manifest.json");
    }

    @Override
    public InvocationErrorKind getKind() {
        return InvocationErrorKind.TEMPLATE_NOT_DECLARED;
    }
}
