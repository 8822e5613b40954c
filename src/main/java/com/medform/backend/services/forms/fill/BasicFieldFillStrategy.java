package com.medform.backend.services.forms.fill;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDTextField;
import org.springframework.stereotype.Component;

import com.medform.backend.services.forms.template.FieldMapping;
import com.medform.backend.services.forms.template.FieldMappingTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Looser AcroForm fill: text fields only, matched when a mapping's search term appears
 * anywhere in the field name (case-insensitive).
 */
@Component
@Slf4j
public class BasicFieldFillStrategy implements FillStrategy {

    @Override
    public FillMethod method() {
        return FillMethod.BASIC_FIELDS;
    }

    @Override
    public FillingResult fill(FillRequest request) {
        List<String> warnings = new ArrayList<>();
        FieldMappingTable table = request.template().table();

        try (PDDocument doc = PdfOutput.open(request)) {
            PDAcroForm form = doc.getDocumentCatalog().getAcroForm();
            List<PDTextField> textFields = new ArrayList<>();
            if (form != null) {
                for (PDField field : form.getFieldTree()) {
                    if (field instanceof PDTextField text) textFields.add(text);
                }
            }
            if (textFields.isEmpty()) {
                return FillingResult.failure(method(), "Template has no text fields", warnings);
            }

            int filled = 0;
            for (PDTextField field : textFields) {
                String value = valueFor(field.getFullyQualifiedName(), table, request);
                if (value == null) continue;
                try {
                    field.setValue(value);
                    filled++;
                } catch (IOException | IllegalArgumentException e) {
                    warnings.add("Could not set field '" + field.getFullyQualifiedName() + "': " + e.getMessage());
                }
            }

            if (filled == 0) {
                return FillingResult.failure(method(), "No text field name matched any search term", warnings);
            }
            form.setNeedAppearances(true);
            PdfOutput.save(doc, request.outputPath());
            log.info("[Fill] basic fields filled={}/{} output={}", filled, textFields.size(), request.outputPath());
            return FillingResult.success(request.outputPath(), filled, textFields.size(), method(), warnings);
        } catch (IOException e) {
            throw new FillingException("Basic fill failed: " + e.getMessage(), e);
        }
    }

    private static String valueFor(String fieldName, FieldMappingTable table, FillRequest request) {
        String name = fieldName == null ? "" : fieldName.toLowerCase(Locale.ROOT);
        for (FieldMapping mapping : table.mappings()) {
            String value = request.form().get(mapping.semanticKey());
            if (value == null || value.isBlank()) continue;
            for (String term : mapping.searchTerms()) {
                if (!term.isBlank() && name.contains(term.toLowerCase(Locale.ROOT))) {
                    return value;
                }
            }
        }
        return null;
    }
}
