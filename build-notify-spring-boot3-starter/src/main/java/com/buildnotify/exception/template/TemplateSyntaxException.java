package com.buildnotify.exception.template;

public class TemplateSyntaxException extends RuntimeException {
    public TemplateSyntaxException(String templateName, Throwable cause) {
        super("malformed template '" + templateName + "': " + cause.getMessage(), cause);
    }
}
