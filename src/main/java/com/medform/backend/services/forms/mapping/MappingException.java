package com.medform.backend.services.forms.mapping;

/**
 * Raised only for structurally invalid mapper input (not a key/value tree).
 */
public class MappingException extends RuntimeException {

    public MappingException(String message) {
        super(message);
    }
}
