package com.medform.backend.services.forms.template;

import java.util.ArrayList;
import java.util.List;

/**
 * One semantic key and the two ways of finding it on a template: native AcroForm field names
 * and a text anchor for overlay placement. Either may be absent but not both.
 */
public record FieldMapping(String semanticKey, List<String> pdfFieldNames, AnchorSpec anchor) {

    public FieldMapping {
        if (semanticKey == null || semanticKey.isBlank()) {
            throw new IllegalArgumentException("semanticKey is required");
        }
        pdfFieldNames = pdfFieldNames == null ? List.of() : List.copyOf(pdfFieldNames);
        if (pdfFieldNames.isEmpty() && anchor == null) {
            throw new IllegalArgumentException("Mapping for " + semanticKey + " has neither field names nor anchor");
        }
    }

    /**
     * Native field names followed by anchor terms, used for fuzzy field-name matching.
     */
    public List<String> searchTerms() {
        List<String> terms = new ArrayList<>(pdfFieldNames);
        if (anchor != null) {
            for (String term : anchor.searchTerms()) {
                if (!terms.contains(term)) terms.add(term);
            }
        }
        return terms;
    }
}
