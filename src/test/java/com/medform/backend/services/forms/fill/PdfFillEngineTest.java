package com.medform.backend.services.forms.fill;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.medform.backend.services.forms.mapping.MappedForm;
import com.medform.backend.services.forms.schema.AshSchema;
import com.medform.backend.services.forms.template.FormTemplate;
import com.medform.backend.services.forms.template.TargetFormat;
import com.medform.backend.support.TestPdfs;

class PdfFillEngineTest {

    @TempDir
    Path dir;

    private final PdfFillEngine engine = new PdfFillEngine(
            new StructuredFieldFillStrategy(), new BasicFieldFillStrategy(), new OverlayFillStrategy());

    private static MappedForm form(Map<String, String> fields) {
        return new MappedForm(fields, new MappedForm.Metadata("MNR", "ASH", fields.size(), fields.size()));
    }

    private static FormTemplate template(byte[] bytes, Set<String> live) {
        TargetFormat format = TargetFormat.TARGET_SCHEMA;
        return new FormTemplate(format, Path.of("ash_medical_form.pdf"), bytes, format.table(), live,
                format.table().crossValidate(live));
    }

    @Test
    void acroFormTemplate_filledThroughStructuredFields() throws Exception {
        FormTemplate template = template(
                TestPdfs.acroFormPdf(List.of("PCP Name", "Weight", "Pain Level", "Clinic Name")),
                Set.of("PCP Name", "Weight", "Pain Level", "Clinic Name"));
        Path out = dir.resolve("out/filled.pdf");

        FillingResult result = engine.fill(form(Map.of(
                AshSchema.PRIMARY_CARE_PHYSICIAN, "Dr. Roe",
                AshSchema.WEIGHT, "170 lbs",
                AshSchema.CURRENT_PAIN, "9/10")), template, out, true);

        assertTrue(result.success());
        assertEquals(FillMethod.STRUCTURED_FIELDS, result.methodUsed());
        assertEquals(3, result.fieldsFilled());
        assertEquals(4, result.totalFields());
        assertEquals(out, result.outputPath());
        byte[] filled = Files.readAllBytes(out);
        assertEquals("170 lbs", TestPdfs.fieldValue(filled, "Weight"));
        assertEquals("9/10", TestPdfs.fieldValue(filled, "Pain Level"));
        assertEquals("Dr. Roe", TestPdfs.fieldValue(filled, "PCP Name"));
    }

    @Test
    void activityCells_splitFromJoinedValue() throws Exception {
        List<String> names = List.of("Activity#0", "Measurements", "How has it changed?", "Activity#1");
        FormTemplate template = template(TestPdfs.acroFormPdf(names), Set.copyOf(names));
        Path out = dir.resolve("activities.pdf");

        FillingResult result = engine.fill(form(Map.of(AshSchema.ACTIVITIES_MONITORED,
                "Activity: Walking | Measurement: 10 min | Change: 20 min; Activity: Sitting")), template, out, true);

        assertTrue(result.success());
        byte[] filled = Files.readAllBytes(out);
        assertEquals("Walking", TestPdfs.fieldValue(filled, "Activity#0"));
        assertEquals("10 min", TestPdfs.fieldValue(filled, "Measurements"));
        assertEquals("20 min", TestPdfs.fieldValue(filled, "How has it changed?"));
        assertEquals("Sitting", TestPdfs.fieldValue(filled, "Activity#1"));
    }

    @Test
    void flatTemplate_fallsBackToOverlay() throws Exception {
        FormTemplate template = template(TestPdfs.textPdf("Weight:", "Current Pain Level:", "Notes"), Set.of());
        Path out = dir.resolve("overlay.pdf");

        FillingResult result = engine.fill(form(Map.of(
                AshSchema.WEIGHT, "170 lbs",
                AshSchema.CURRENT_PAIN, "9/10",
                AshSchema.CLINIC_NAME, "Elm Street")), template, out, true);

        assertTrue(result.success());
        assertEquals(FillMethod.OVERLAY, result.methodUsed());
        assertEquals(2, result.fieldsFilled());
        assertTrue(result.warnings().stream().anyMatch(w -> w.startsWith("structured_fields:")));
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains(AshSchema.CLINIC_NAME)));
        String text = TestPdfs.extractText(Files.readAllBytes(out));
        assertTrue(text.contains("170 lbs"));
        assertTrue(text.contains("9/10"));
    }

    @Test
    void notEnhanced_triesBasicFieldsFirst() throws Exception {
        FormTemplate template = template(TestPdfs.acroFormPdf(List.of("Patient Weight")), Set.of("Patient Weight"));
        Path out = dir.resolve("basic.pdf");

        FillingResult result = engine.fill(form(Map.of(AshSchema.WEIGHT, "170 lbs")), template, out, false);

        assertTrue(result.success());
        assertEquals(FillMethod.BASIC_FIELDS, result.methodUsed());
        assertEquals("170 lbs", TestPdfs.fieldValue(Files.readAllBytes(out), "Patient Weight"));
        assertEquals(List.of(FillMethod.BASIC_FIELDS, FillMethod.STRUCTURED_FIELDS, FillMethod.OVERLAY),
                engine.order(false).stream().map(FillStrategy::method).toList());
    }

    @Test
    void nothingPlaceable_allFailed() throws Exception {
        FormTemplate template = template(TestPdfs.textPdf("Nothing relevant here"), Set.of());
        Path out = dir.resolve("none.pdf");

        FillingResult result = engine.fill(form(Map.of(AshSchema.WEIGHT, "170 lbs")), template, out, true);

        assertFalse(result.success());
        assertEquals(FillMethod.ALL_FAILED, result.methodUsed());
        assertTrue(result.error().startsWith("All fill methods failed"));
        assertTrue(result.error().contains("No anchors matched on template"));
        assertNull(result.outputPath());
        assertFalse(Files.exists(out));
    }

    @Test
    void emptyForm_allFailed() throws Exception {
        FormTemplate template = template(TestPdfs.textPdf("Weight:"), Set.of());

        FillingResult result = engine.fill(form(Map.of()), template, dir.resolve("empty.pdf"), true);

        assertFalse(result.success());
        assertEquals(FillMethod.ALL_FAILED, result.methodUsed());
    }
}
