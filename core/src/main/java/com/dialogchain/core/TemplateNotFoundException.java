package com.dialogchain.core;

import java.util.Collection;

public class TemplateNotFoundException extends RuntimeException {
    private final String templateName;

    public TemplateNotFoundException(String templateName, Collection<String> available) {
        super("Template '" + templateName + "' not found (available: " + String.join(", ", available) + ")");
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
