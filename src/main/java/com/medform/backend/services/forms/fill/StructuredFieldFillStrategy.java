package com.medform.backend.services.forms.fill;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDCheckBox;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDNonTerminalField;
import org.apache.pdfbox.pdmodel.interactive.form.PDRadioButton;
import org.apache.pdfbox.pdmodel.interactive.form.PDTextField;
import org.springframework.stereotype.Component;

import com.medform.backend.services.forms.schema.AshSchema;
import com.medform.backend.services.forms.template.FieldMappingTable;

import lombok.extern.slf4j.Slf4j;

/**
 * Fills native AcroForm fields by exact fully qualified name.
 */
@Component
@Slf4j
public class StructuredFieldFillStrategy implements FillStrategy {

    @Override
    public FillMethod method() {
        return FillMethod.STRUCTURED_FIELDS;
    }

    @Override
    public FillingResult fill(FillRequest request) {
        List<String> warnings = new ArrayList<>();
        FieldMappingTable table = request.template().table();

        try (PDDocument doc = PdfOutput.open(request)) {
            PDAcroForm form = doc.getDocumentCatalog().getAcroForm();
            if (form == null || form.getFields().isEmpty()) {
                return FillingResult.failure(method(), "Template has no AcroForm fields", warnings);
            }

            int total = 0;
            int filled = 0;
            for (PDField field : form.getFieldTree()) {
                if (field instanceof PDNonTerminalField) continue;
                total++;
                String name = field.getFullyQualifiedName();
                Optional<String> key = table.keyForPdfField(name);
                if (key.isEmpty()) continue;

                String value = request.form().get(key.get());
                if (AshSchema.ACTIVITIES_MONITORED.equals(key.get())) {
                    value = ActivityFieldSplitter.cellValue(value, name);
                }
                if (value == null || value.isBlank()) continue;

                try {
                    if (setValue(field, value)) filled++;
                } catch (IOException | IllegalArgumentException e) {
                    warnings.add("Could not set field '" + name + "': " + e.getMessage());
                }
            }

            if (filled == 0) {
                return FillingResult.failure(method(), "No AcroForm field matched the mapped values", warnings);
            }
            form.setNeedAppearances(true);
            PdfOutput.save(doc, request.outputPath());
            log.info("[Fill] structured fields filled={}/{} output={}", filled, total, request.outputPath());
            return FillingResult.success(request.outputPath(), filled, total, method(), warnings);
        } catch (IOException e) {
            throw new FillingException("Structured fill failed: " + e.getMessage(), e);
        }
    }

    private static boolean setValue(PDField field, String value) throws IOException {
        if (field instanceof PDTextField text) {
            text.setValue(value);
            return true;
        }
        if (field instanceof PDCheckBox box) {
            if (PdfOutput.isTruthy(value)) {
                box.check();
            } else {
                box.unCheck();
            }
            return true;
        }
        if (field instanceof PDRadioButton radio) {
            Set<String> onValues = radio.getOnValues();
            if (PdfOutput.isTruthy(value) && !onValues.isEmpty()) {
                radio.setValue(onValues.iterator().next());
                return true;
            }
            return false;
        }
        return false;
    }
}
