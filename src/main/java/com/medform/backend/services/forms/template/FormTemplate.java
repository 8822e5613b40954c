package com.medform.backend.services.forms.template;

import java.nio.file.Path;
import java.util.Set;

/**
 * A loaded template: raw bytes plus what was learned about its AcroForm inventory.
 */
public record FormTemplate(TargetFormat format, Path path, byte[] bytes, FieldMappingTable table,
                           Set<String> liveFieldNames, Set<String> unmappedFields) {

    public FormTemplate {
        liveFieldNames = Set.copyOf(liveFieldNames);
        unmappedFields = Set.copyOf(unmappedFields);
    }

    public boolean hasNativeFields() {
        return !liveFieldNames.isEmpty();
    }
}
