package com.dialogchain.core;

public class InvalidTemplateException extends RuntimeException {
    private final String templateName;

    public InvalidTemplateException(String templateName, String message) {
        super("Template '" + templateName + "' is invalid: " + message);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
