package com.chih.JTemplate.core.exception;

public class BindingsParseException extends JTemplateException {
    public BindingsParseException(String fileName, Throwable cause) {
        super("Failed to parse bindings file: " + fileName, cause);
    }
}
