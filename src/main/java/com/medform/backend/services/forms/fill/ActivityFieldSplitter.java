package com.medform.backend.services.forms.fill;

import java.util.List;

import com.medform.backend.services.forms.template.AshFieldMappings;

/**
 * Splits the joined activities string back into the per-entry table cells of the ASH form.
 */
final class ActivityFieldSplitter {

    private ActivityFieldSplitter() {
    }

    /**
     * Value for one activity table cell, or null when the joined string has no such part.
     */
    static String cellValue(String joined, String pdfFieldName) {
        if (joined == null || joined.isBlank()) return null;
        int slot = AshFieldMappings.activitySlot(pdfFieldName);
        if (slot < 0) return null;

        String[] segments = joined.split(";\\s*");
        if (slot >= segments.length) return null;

        String prefix;
        if (AshFieldMappings.ACTIVITY_FIELDS.contains(pdfFieldName)) {
            prefix = "Activity:";
        } else if (AshFieldMappings.MEASUREMENT_FIELDS.contains(pdfFieldName)) {
            prefix = "Measurement:";
        } else {
            prefix = "Change:";
        }

        for (String part : List.of(segments[slot].split("\\s*\\|\\s*"))) {
            String p = part.trim();
            if (p.startsWith(prefix)) {
                String v = p.substring(prefix.length()).trim();
                return v.isEmpty() ? null : v;
            }
        }
        return null;
    }
}
