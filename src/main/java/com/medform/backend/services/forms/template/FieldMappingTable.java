package com.medform.backend.services.forms.template;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static semantic-key to template-location table. Immutable once built.
 */
public final class FieldMappingTable {

    private final String name;
    private final Map<String, FieldMapping> byKey;
    private final Map<String, String> keyByPdfField;

    private FieldMappingTable(String name, Map<String, FieldMapping> byKey) {
        this.name = name;
        this.byKey = Collections.unmodifiableMap(byKey);
        Map<String, String> reverse = new LinkedHashMap<>();
        for (FieldMapping mapping : byKey.values()) {
            for (String pdfField : mapping.pdfFieldNames()) {
                reverse.putIfAbsent(pdfField, mapping.semanticKey());
            }
        }
        this.keyByPdfField = Collections.unmodifiableMap(reverse);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public Optional<FieldMapping> find(String semanticKey) {
        return Optional.ofNullable(byKey.get(semanticKey));
    }

    public boolean contains(String semanticKey) {
        return byKey.containsKey(semanticKey);
    }

    public Collection<FieldMapping> mappings() {
        return byKey.values();
    }

    public Optional<String> keyForPdfField(String pdfFieldName) {
        return Optional.ofNullable(keyByPdfField.get(pdfFieldName));
    }

    public Set<String> pdfFieldNames() {
        return keyByPdfField.keySet();
    }

    public int size() {
        return byKey.size();
    }

    /**
     * Semantic keys that declare native field names none of which exist in {@code liveFieldNames}.
     * Anchor-only keys are never reported; they are placed by overlay.
     */
    public Set<String> crossValidate(Set<String> liveFieldNames) {
        Set<String> live = liveFieldNames == null ? Set.of() : liveFieldNames;
        Set<String> unmapped = new LinkedHashSet<>();
        for (FieldMapping mapping : byKey.values()) {
            if (mapping.pdfFieldNames().isEmpty()) continue;
            boolean anyPresent = mapping.pdfFieldNames().stream().anyMatch(live::contains);
            if (!anyPresent) {
                unmapped.add(mapping.semanticKey());
            }
        }
        return Collections.unmodifiableSet(unmapped);
    }

    public static final class Builder {

        private final String name;
        private final Map<String, FieldMapping> entries = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder field(String key, List<String> pdfFieldNames, AnchorSpec anchor) {
            FieldMapping previous = entries.put(key, new FieldMapping(key, pdfFieldNames, anchor));
            if (previous != null) {
                throw new IllegalStateException("Duplicate mapping for " + key + " in " + name);
            }
            return this;
        }

        public Builder anchored(String key, AnchorSpec anchor) {
            return field(key, List.of(), anchor);
        }

        public FieldMappingTable build() {
            return new FieldMappingTable(name, new LinkedHashMap<>(entries));
        }
    }

    @Override
    public String toString() {
        return "FieldMappingTable[" + name + ", " + new ArrayList<>(byKey.keySet()) + "]";
    }
}
