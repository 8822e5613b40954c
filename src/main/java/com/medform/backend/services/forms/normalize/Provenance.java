package com.medform.backend.services.forms.normalize;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How a normalized tree was produced. Serialized as {@code _provenance} in intermediate dumps.
 */
public record Provenance(
        String processor,
        String validationMethod,
        Instant processedAt,
        List<String> validationErrors,
        boolean requiredFieldsPresent
) {

    public Provenance {
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("processor", processor);
        m.put("validation_method", validationMethod);
        m.put("processed_at", processedAt == null ? null : processedAt.toString());
        m.put("validation_errors", validationErrors);
        m.put("required_fields_present", requiredFieldsPresent);
        return m;
    }
}
