package com.medform.backend.services.forms.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat {@code semantic key -> display string} map for one output form, plus mapping counts
 * kept outside the map.
 */
public record MappedForm(Map<String, String> fields, Metadata metadata) {

    public MappedForm {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
    }

    public String get(String key) {
        return fields.get(key);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    public record Metadata(String mappedFrom, String mappedTo, int sourceFieldCount, int mappedFieldCount) {

        public Map<String, Object> toMap() {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("mapped_from", mappedFrom);
            m.put("mapped_to", mappedTo);
            m.put("original_fields_count", sourceFieldCount);
            m.put("mapped_fields_count", mappedFieldCount);
            return m;
        }
    }
}
