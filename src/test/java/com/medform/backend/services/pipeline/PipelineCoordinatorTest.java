package com.medform.backend.services.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medform.backend.config.CacheProperties;
import com.medform.backend.config.TemplateProperties;
import com.medform.backend.services.cache.CacheStore;
import com.medform.backend.services.extraction.ExtractionMethod;
import com.medform.backend.services.extraction.ExtractionOrchestrator;
import com.medform.backend.services.extraction.ExtractionResult;
import com.medform.backend.services.extraction.ExtractionStrategy;
import com.medform.backend.services.extraction.ExtractionStrategyRegistry;
import com.medform.backend.services.extraction.SourceDocument;
import com.medform.backend.services.forms.fill.BasicFieldFillStrategy;
import com.medform.backend.services.forms.fill.FillMethod;
import com.medform.backend.services.forms.fill.OverlayFillStrategy;
import com.medform.backend.services.forms.fill.PdfFillEngine;
import com.medform.backend.services.forms.fill.StructuredFieldFillStrategy;
import com.medform.backend.services.forms.mapping.SourceFormProjector;
import com.medform.backend.services.forms.mapping.TargetFormMapper;
import com.medform.backend.services.forms.normalize.SourceFormValidator;
import com.medform.backend.services.forms.schema.AshSchema;
import com.medform.backend.services.forms.schema.MnrSchema;
import com.medform.backend.services.forms.template.TargetFormat;
import com.medform.backend.services.forms.template.TemplateRegistry;
import com.medform.backend.support.MutableClock;
import com.medform.backend.support.TestPdfs;

class PipelineCoordinatorTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private ExecutorService executor;
    private CountingStrategy strategy;
    private PipelineCoordinator coordinator;
    private SourceDocument document;

    /**
     * Vision stand-in returning a fixed result and counting calls.
     */
    private static final class CountingStrategy implements ExtractionStrategy {

        private ExtractionResult result;
        private final AtomicInteger calls = new AtomicInteger();

        @Override
        public ExtractionMethod method() {
            return ExtractionMethod.VISION;
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public ExtractionResult extract(SourceDocument document) {
            calls.incrementAndGet();
            return result;
        }
    }

    private static Map<String, Object> extractedTree() {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put(MnrSchema.PRIMARY_CARE_PHYSICIAN, "Dr. Roe");
        tree.put(MnrSchema.CURRENT_HEALTH_PROBLEMS, "Low back pain");
        tree.put(MnrSchema.PAIN_LEVEL, Map.of(MnrSchema.PAIN_CURRENT, "9/10"));
        tree.put(MnrSchema.WEIGHT_LBS, 170);
        return tree;
    }

    @BeforeEach
    void setUp() throws Exception {
        Path templates = dir.resolve("templates");
        Files.createDirectories(templates);
        Files.write(templates.resolve("ash_medical_form.pdf"),
                TestPdfs.acroFormPdf(List.of("PCP Name", "Weight", "Pain Level")));
        Files.write(templates.resolve("mnr_form.pdf"), TestPdfs.textPdf(
                "Primary Care Physician:", "Current health problems:", "Current Pain Level:", "Weight:"));

        clock = new MutableClock(Instant.parse("2026-05-04T09:30:00Z"));
        executor = Executors.newSingleThreadExecutor();
        strategy = new CountingStrategy();
        strategy.result = ExtractionResult.success(extractedTree(), ExtractionMethod.VISION, 0.95, 0.012);
        coordinator = coordinator(templates);
        document = new SourceDocument(TestPdfs.textPdf("scanned form"), "application/pdf", "patient scan.pdf");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private PipelineCoordinator coordinator(Path templateDir) {
        TemplateProperties templateProperties = new TemplateProperties();
        templateProperties.setSearchPaths(List.of(templateDir.toString()));
        CacheStore cacheStore = new CacheStore(clock, new CacheProperties());
        return new PipelineCoordinator(
                new TemplateRegistry(templateProperties, cacheStore),
                cacheStore,
                new ExtractionOrchestrator(new ExtractionStrategyRegistry(List.of(strategy))),
                new SourceFormValidator(clock),
                new TargetFormMapper(),
                new SourceFormProjector(),
                new PdfFillEngine(new StructuredFieldFillStrategy(), new BasicFieldFillStrategy(),
                        new OverlayFillStrategy()),
                new PipelineOutputWriter(clock, new ObjectMapper()),
                executor);
    }

    private PipelineConfig config(String outputFormat) {
        return PipelineConfig.builder()
                .outputFormat(outputFormat)
                .outputDirectory(dir.resolve("out").toString())
                .userId("user-1")
                .sessionId("session-1")
                .build();
    }

    @Test
    void targetOnly_fillsAcroFormTemplate() throws Exception {
        PipelineResult result = coordinator.process(document, config("target_schema"), null);

        assertTrue(result.isSuccess(), result.getError());
        assertEquals(PipelineStage.COMPLETED, result.getStageReached());
        assertNull(result.getFailedStage());
        assertEquals(FillMethod.STRUCTURED_FIELDS, result.getFillingResult().methodUsed());
        assertNull(result.getSecondaryFillingResult());
        assertEquals("170 lbs", result.getMappedForm().get(AshSchema.WEIGHT));
        assertEquals(0.012, result.getTotalCost(), 1e-9);

        Path output = result.getFillingResult().outputPath();
        assertTrue(output.getFileName().toString().startsWith("patient_scan_target_schema_filled_20260504_093000_"));
        assertEquals("170 lbs", TestPdfs.fieldValue(Files.readAllBytes(output), "Weight"));
        assertEquals("9/10", TestPdfs.fieldValue(Files.readAllBytes(output), "Pain Level"));

        assertEquals(PipelineCoordinator.PIPELINE_VERSION, result.getMetadata().get("pipeline_version"));
        assertEquals("vision", result.getMetadata().get("extraction_method"));
        assertEquals("user-1", result.getMetadata().get("user_id"));
    }

    @Test
    void both_extractsOnceAndFillsTwoTemplates() {
        PipelineResult result = coordinator.process(document, config("both"), null);

        assertTrue(result.isSuccess(), result.getError());
        assertEquals(1, strategy.calls.get());
        assertEquals(2, result.getFillingResults().size());
        assertEquals(FillMethod.STRUCTURED_FIELDS, result.getFillingResult().methodUsed());
        assertEquals(FillMethod.OVERLAY, result.getSecondaryFillingResult().methodUsed());
        assertEquals(2, result.outputPaths().size());
        assertEquals("Dr. Roe", result.getMappedForms().get(TargetFormat.SOURCE_SCHEMA)
                .get(MnrSchema.PRIMARY_CARE_PHYSICIAN));
        assertTrue(result.getSecondaryFillingResult().outputPath().getFileName().toString()
                .contains("_source_schema_filled_"));
    }

    @Test
    void repeatedDocument_servedFromCache() {
        coordinator.process(document, config("target_schema"), null);
        PipelineResult second = coordinator.process(document, config("target_schema"), null);

        assertTrue(second.isSuccess());
        assertEquals(1, strategy.calls.get());
        assertEquals(ExtractionMethod.CACHED, second.getExtractionResult().methodUsed());
        assertEquals(0d, second.getTotalCost());
        assertEquals("cached", second.getMetadata().get("extraction_method"));
    }

    @Test
    void otherRequester_doesNotShareCache() {
        coordinator.process(document, config("target_schema"), null);
        PipelineConfig other = config("target_schema").toBuilder().userId("user-2").build();

        PipelineResult result = coordinator.process(document, other, null);

        assertEquals(2, strategy.calls.get());
        assertEquals(ExtractionMethod.VISION, result.getExtractionResult().methodUsed());
    }

    @Test
    void extractionFailure_stopsBeforeMapping() {
        strategy.result = ExtractionResult.failure(ExtractionMethod.VISION, "model unreachable");

        PipelineResult result = coordinator.process(document, config("target_schema"), null);

        assertFalse(result.isSuccess());
        assertEquals(PipelineStage.FAILED, result.getStageReached());
        assertEquals(PipelineStage.EXTRACTION, result.getFailedStage());
        assertTrue(result.getError().contains("model unreachable"));
        assertEquals(ExtractionMethod.ALL_FAILED, result.getExtractionResult().methodUsed());
        assertNull(result.getNormalizedForm());
        assertTrue(result.getFillingResults().isEmpty());

        coordinator.process(document, config("target_schema"), null);
        assertEquals(2, strategy.calls.get());
    }

    @Test
    void missingTemplate_failsWithoutExtracting() throws Exception {
        Path onlyAsh = dir.resolve("only-ash");
        Files.createDirectories(onlyAsh);
        Files.write(onlyAsh.resolve("ash_medical_form.pdf"), TestPdfs.acroFormPdf(List.of("Weight")));

        PipelineResult result = coordinator(onlyAsh).process(document, config("both"), null);

        assertFalse(result.isSuccess());
        assertEquals(PipelineStage.EXTRACTION, result.getFailedStage());
        assertTrue(result.getError().contains("mnr_form.pdf"));
        assertEquals(0, strategy.calls.get());
    }

    @Test
    void unfillableTemplate_failsAtFilling() throws Exception {
        Path flat = dir.resolve("flat");
        Files.createDirectories(flat);
        Files.write(flat.resolve("ash_medical_form.pdf"), TestPdfs.textPdf("Nothing to anchor on"));

        PipelineResult result = coordinator(flat).process(document, config("target_schema"), null);

        assertFalse(result.isSuccess());
        assertEquals(PipelineStage.FILLING, result.getFailedStage());
        assertNotNull(result.getMappedForm());
        assertEquals(FillMethod.ALL_FAILED, result.getFillingResult().methodUsed());
    }

    @Test
    void observer_receivesStagesInOrder() {
        InMemoryProgressTracker tracker = new InMemoryProgressTracker(clock);

        coordinator.process(document, config("target_schema"), tracker.observer("session-1"));

        List<ProgressStage> stages = tracker.history("session-1").stream().map(ProgressUpdate::stage).distinct().toList();
        assertEquals(List.of(ProgressStage.EXTRACTION, ProgressStage.PROCESSING, ProgressStage.PDF_GENERATION,
                ProgressStage.FINALIZATION, ProgressStage.COMPLETED), stages);
        assertTrue(tracker.isFinished("session-1"));
    }

    @Test
    void observerErrors_doNotBreakTheRun() {
        ProgressObserver broken = (stage, message, completed, details) -> {
            throw new IllegalStateException("socket closed");
        };

        PipelineResult result = coordinator.process(document, config("target_schema"), broken);

        assertTrue(result.isSuccess());
    }

    @Test
    void failureEvent_carriesFailedStage() {
        strategy.result = ExtractionResult.failure(ExtractionMethod.VISION, "model unreachable");
        InMemoryProgressTracker tracker = new InMemoryProgressTracker(clock);

        coordinator.process(document, config("target_schema"), tracker.observer("s"));

        ProgressUpdate last = tracker.latest("s").orElseThrow();
        assertEquals(ProgressStage.FAILED, last.stage());
        assertEquals("extraction", last.details().get("failed_stage"));
    }

    @Test
    void saveIntermediate_writesJsonDump() throws Exception {
        PipelineConfig cfg = config("target_schema").toBuilder().saveIntermediate(true).build();

        PipelineResult result = coordinator.process(document, cfg, null);

        assertNotNull(result.getIntermediatePath());
        String json = Files.readString(result.getIntermediatePath());
        assertTrue(json.contains("\"normalized\""));
        assertTrue(json.contains("\"target_schema\""));
        assertTrue(json.contains("170 lbs"));
    }
}
