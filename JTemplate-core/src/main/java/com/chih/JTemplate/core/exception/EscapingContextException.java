package com.chih.JTemplate.core.exception;

public class EscapingContextException extends JTemplateException {
    public EscapingContextException(String message) {
        super(message);
    }
}
