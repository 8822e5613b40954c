package com.medform.backend.services.forms.template;

public class TemplateMissingException extends RuntimeException {

    private final TargetFormat format;

    public TemplateMissingException(TargetFormat format, String message) {
        super(message);
        this.format = format;
    }

    public TemplateMissingException(TargetFormat format, String message, Throwable cause) {
        super(message, cause);
        this.format = format;
    }

    public TargetFormat getFormat() {
        return format;
    }
}
