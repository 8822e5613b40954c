package com.medform.backend.services.forms.normalize;

import java.util.LinkedHashMap;
import java.util.Map;

import com.medform.backend.services.util.TreeValues;

/**
 * Source-schema tree after validation and coercion. Read-only.
 */
public record NormalizedForm(Map<String, Object> data, Provenance provenance) {

    public static final String PROVENANCE_KEY = "_provenance";

    public NormalizedForm {
        data = TreeValues.immutableCopyMap(data == null ? Map.of() : data);
    }

    /**
     * True only when all mandatory source fields were present.
     */
    public boolean success() {
        return provenance != null && provenance.requiredFieldsPresent();
    }

    public Object get(String field) {
        return data.get(field);
    }

    /**
     * Tree plus the {@code _provenance} block, as written to intermediate dumps.
     */
    public Map<String, Object> toTree() {
        Map<String, Object> tree = new LinkedHashMap<>(data);
        if (provenance != null) {
            tree.put(PROVENANCE_KEY, provenance.toMap());
        }
        return tree;
    }
}
