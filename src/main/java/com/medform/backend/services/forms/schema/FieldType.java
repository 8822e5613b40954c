package com.medform.backend.services.forms.schema;

import java.util.List;
import java.util.Map;

public enum FieldType {
    TEXT,
    NUMBER,
    TEXT_OR_NUMBER,
    OBJECT,
    LIST;

    public boolean accepts(Object value) {
        return switch (this) {
            case TEXT -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case TEXT_OR_NUMBER -> value instanceof String || value instanceof Number;
            case OBJECT -> value instanceof Map<?, ?>;
            case LIST -> value instanceof List<?>;
        };
    }
}
