package com.medform.backend.services.forms.fill;

public class FillingException extends RuntimeException {

    public FillingException(String message) {
        super(message);
    }

    public FillingException(String message, Throwable cause) {
        super(message, cause);
    }
}
