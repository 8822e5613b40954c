package com.medform.backend.services.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.medform.backend.services.cache.CacheStore;
import com.medform.backend.services.extraction.ExtractionException;
import com.medform.backend.services.extraction.ExtractionMethod;
import com.medform.backend.services.extraction.ExtractionOrchestrator;
import com.medform.backend.services.extraction.ExtractionResult;
import com.medform.backend.services.extraction.SourceDocument;
import com.medform.backend.services.forms.fill.FillMethod;
import com.medform.backend.services.forms.fill.FillingException;
import com.medform.backend.services.forms.fill.FillingResult;
import com.medform.backend.services.forms.fill.PdfFillEngine;
import com.medform.backend.services.forms.mapping.MappedForm;
import com.medform.backend.services.forms.mapping.MappingException;
import com.medform.backend.services.forms.mapping.SourceFormProjector;
import com.medform.backend.services.forms.mapping.TargetFormMapper;
import com.medform.backend.services.forms.normalize.NormalizedForm;
import com.medform.backend.services.forms.normalize.SourceFormValidator;
import com.medform.backend.services.forms.template.OutputFormat;
import com.medform.backend.services.forms.template.TargetFormat;
import com.medform.backend.services.forms.template.TemplateMissingException;
import com.medform.backend.services.forms.template.TemplateRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs extraction, normalization and mapping, then filling for one document. Stops at the
 * first failing stage and keeps whatever was produced before it.
 */
@Service
@Slf4j
public class PipelineCoordinator {

    public static final String PIPELINE_VERSION = "1.0.0";

    private final TemplateRegistry templateRegistry;
    private final CacheStore cacheStore;
    private final ExtractionOrchestrator extractionOrchestrator;
    private final SourceFormValidator validator;
    private final TargetFormMapper targetMapper;
    private final SourceFormProjector sourceProjector;
    private final PdfFillEngine fillEngine;
    private final PipelineOutputWriter outputWriter;
    private final Executor executor;

    public PipelineCoordinator(TemplateRegistry templateRegistry,
                               CacheStore cacheStore,
                               ExtractionOrchestrator extractionOrchestrator,
                               SourceFormValidator validator,
                               TargetFormMapper targetMapper,
                               SourceFormProjector sourceProjector,
                               PdfFillEngine fillEngine,
                               PipelineOutputWriter outputWriter,
                               @Qualifier("pipelineTaskExecutor") Executor executor) {
        this.templateRegistry = templateRegistry;
        this.cacheStore = cacheStore;
        this.extractionOrchestrator = extractionOrchestrator;
        this.validator = validator;
        this.targetMapper = targetMapper;
        this.sourceProjector = sourceProjector;
        this.fillEngine = fillEngine;
        this.outputWriter = outputWriter;
        this.executor = executor;
    }

    /**
     * Same as {@link #process} but on the pipeline worker pool, off the caller's thread.
     */
    @Async("pipelineTaskExecutor")
    public CompletableFuture<PipelineResult> processAsync(SourceDocument document, PipelineConfig config,
                                                          ProgressObserver observer) {
        return CompletableFuture.completedFuture(process(document, config, observer));
    }

    public PipelineResult process(SourceDocument document, PipelineConfig config, ProgressObserver observer) {
        if (document == null) throw new IllegalArgumentException("document is required");
        if (config == null) throw new IllegalArgumentException("config is required");

        long started = System.nanoTime();
        ProgressObserver progress = observer == null ? ProgressObserver.NONE : observer;
        OutputFormat outputFormat = OutputFormat.fromCode(config.getOutputFormat());
        ExtractionMethod method = ExtractionMethod.fromCode(config.getExtractionMethod());

        PipelineResult result = PipelineResult.builder()
                .outputFormat(outputFormat)
                .stageReached(PipelineStage.EXTRACTION)
                .build();

        log.info("[Pipeline] start file={} bytes={} method={} output={} session={}",
                document.baseName(), document.bytes().length, method.code(), outputFormat.code(), config.getSessionId());

        try {
            templateRegistry.requireAll(outputFormat.formats());
        } catch (TemplateMissingException e) {
            return fail(result, PipelineStage.EXTRACTION, e.getMessage(), progress, started);
        }

        // extraction
        notify(progress, ProgressStage.EXTRACTION, "Extracting form data", false, Map.of("method", method.code()));
        ExtractionResult extraction = extract(document, method, config);
        result.setExtractionResult(extraction);
        result.setTotalCost(extraction.cost());
        if (!extraction.success()) {
            return fail(result, PipelineStage.EXTRACTION, extraction.error(), progress, started);
        }
        notify(progress, ProgressStage.EXTRACTION, "Extraction complete", true, Map.of(
                "method", extraction.methodUsed().code(),
                "confidence", extraction.confidence(),
                "cost", extraction.cost()));

        // normalization + mapping
        result.setStageReached(PipelineStage.MAPPING);
        notify(progress, ProgressStage.PROCESSING, "Validating and mapping fields", false, Map.of());
        NormalizedForm normalized;
        try {
            normalized = validator.process(extraction.data());
            result.setNormalizedForm(normalized);
            result.getWarnings().addAll(normalized.provenance().validationErrors());
            for (TargetFormat format : outputFormat.formats()) {
                result.getMappedForms().put(format, map(format, normalized));
            }
        } catch (MappingException | IllegalArgumentException e) {
            return fail(result, PipelineStage.MAPPING, e.getMessage(), progress, started);
        }
        notify(progress, ProgressStage.PROCESSING, "Mapping complete", true, Map.of(
                "validation_errors", normalized.provenance().validationErrors().size(),
                "mapped_fields", result.getMappedForms().values().stream().mapToInt(MappedForm::size).sum()));

        // filling
        result.setStageReached(PipelineStage.FILLING);
        notify(progress, ProgressStage.PDF_GENERATION, "Filling " + outputFormat.code() + " PDF", false, Map.of());
        String baseName = document.baseName();
        Map<TargetFormat, FillingResult> fills = fillAll(outputFormat, result.getMappedForms(), config, baseName);
        result.getFillingResults().putAll(fills);
        List<String> fillErrors = new ArrayList<>();
        for (Map.Entry<TargetFormat, FillingResult> e : fills.entrySet()) {
            FillingResult r = e.getValue();
            result.getWarnings().addAll(r.warnings());
            if (!r.success()) fillErrors.add(e.getKey().code() + ": " + r.error());
        }
        if (!fillErrors.isEmpty()) {
            return fail(result, PipelineStage.FILLING, String.join("; ", fillErrors), progress, started);
        }
        Map<String, Object> fillDetails = new LinkedHashMap<>();
        fills.forEach((format, r) -> fillDetails.put(format.code(), r.methodUsed().code()));
        notify(progress, ProgressStage.PDF_GENERATION, "PDF generation complete", true, fillDetails);

        // finalization
        notify(progress, ProgressStage.FINALIZATION, "Finalizing", false, Map.of());
        if (config.isSaveIntermediate()) {
            try {
                result.setIntermediatePath(outputWriter.writeIntermediate(
                        config.getOutputDirectory(), baseName, normalized, result.getMappedForms()));
                notify(progress, ProgressStage.FINALIZATION, "Intermediate data saved", false, Map.of());
            } catch (IOException e) {
                log.warn("[Pipeline] intermediate JSON not written: {}", e.getMessage());
                result.getWarnings().add("Intermediate JSON not written: " + e.getMessage());
            }
        }
        if (config.isIncludeMetadata()) {
            result.getMetadata().putAll(metadata(config, extraction, outputFormat));
        }
        notify(progress, ProgressStage.FINALIZATION, "Finalization complete", true, Map.of());

        result.setSuccess(true);
        result.setStageReached(PipelineStage.COMPLETED);
        result.setTotalProcessingTime(elapsedSeconds(started));
        notify(progress, ProgressStage.COMPLETED, "Processing complete", true, Map.of(
                "outputs", result.outputPaths().stream().map(Path::toString).toList()));
        log.info("[Pipeline] completed file={} outputs={} cost={} seconds={}",
                baseName, result.outputPaths().size(), result.getTotalCost(), result.getTotalProcessingTime());
        return result;
    }

    private ExtractionResult extract(SourceDocument document, ExtractionMethod method, PipelineConfig config) {
        String cacheKey = cacheStore.contentKey(document.bytes(), config.getUserId());
        var cached = cacheStore.getExtraction(cacheKey, method);
        if (cached.isPresent()) {
            log.info("[Pipeline] extraction cache hit method={}", method.code());
            return cached.get().asCached();
        }
        ExtractionResult extraction;
        try {
            extraction = extractionOrchestrator.extract(document, method, config.isExtractionFallback());
        } catch (ExtractionException e) {
            extraction = ExtractionResult.failure(ExtractionMethod.ALL_FAILED, e.getMessage());
        }
        cacheStore.putExtraction(cacheKey, method, extraction);
        return extraction;
    }

    private MappedForm map(TargetFormat format, NormalizedForm normalized) {
        return format == TargetFormat.TARGET_SCHEMA
                ? targetMapper.map(normalized)
                : sourceProjector.project(normalized);
    }

    private Map<TargetFormat, FillingResult> fillAll(OutputFormat outputFormat, Map<TargetFormat, MappedForm> mapped,
                                                     PipelineConfig config, String baseName) {
        Map<TargetFormat, FillingResult> fills = new EnumMap<>(TargetFormat.class);
        List<TargetFormat> formats = outputFormat.formats();
        if (formats.size() == 1) {
            TargetFormat only = formats.get(0);
            fills.put(only, fillOne(only, mapped.get(only), config, baseName));
            return fills;
        }

        // The second fill goes to the pool; whoever claims it first runs it, so a saturated
        // pool degrades to sequential filling instead of blocking.
        TargetFormat first = formats.get(0);
        TargetFormat second = formats.get(1);
        AtomicBoolean claimed = new AtomicBoolean();
        CompletableFuture<FillingResult> secondFill;
        try {
            secondFill = CompletableFuture.supplyAsync(
                    () -> claimed.compareAndSet(false, true) ? fillOne(second, mapped.get(second), config, baseName) : null,
                    executor);
        } catch (RejectedExecutionException e) {
            log.warn("[Pipeline] worker pool rejected dual fill, running inline: {}", e.getMessage());
            secondFill = null;
        }

        fills.put(first, fillOne(first, mapped.get(first), config, baseName));
        if (claimed.compareAndSet(false, true)) {
            fills.put(second, fillOne(second, mapped.get(second), config, baseName));
        } else {
            fills.put(second, join(secondFill, second));
        }
        return fills;
    }

    private FillingResult join(CompletableFuture<FillingResult> future, TargetFormat format) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Pipeline] {} fill failed", format.code(), cause);
            return FillingResult.failure(FillMethod.ALL_FAILED, cause.getMessage(), List.of());
        }
    }

    private FillingResult fillOne(TargetFormat format, MappedForm mapped, PipelineConfig config, String baseName) {
        try {
            Path output = outputWriter.filledPdfPath(config.getOutputDirectory(), baseName, format);
            return fillEngine.fill(mapped, templateRegistry.load(format), output, config.isEnhancedFilling());
        } catch (FillingException | TemplateMissingException e) {
            return FillingResult.failure(FillMethod.ALL_FAILED, e.getMessage(), List.of());
        }
    }

    private Map<String, Object> metadata(PipelineConfig config, ExtractionResult extraction, OutputFormat outputFormat) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("pipeline_version", PIPELINE_VERSION);
        m.put("stages_completed", List.of(
                PipelineStage.EXTRACTION.code(), PipelineStage.MAPPING.code(), PipelineStage.FILLING.code()));
        m.put("user_id", config.getUserId());
        m.put("session_id", config.getSessionId());
        m.put("extraction_method", extraction.methodUsed().code());
        m.put("output_format", outputFormat.code());
        return m;
    }

    private PipelineResult fail(PipelineResult result, PipelineStage stage, String error, ProgressObserver progress,
                                long started) {
        String message = error == null || error.isBlank() ? "Pipeline failed at " + stage.code() : error;
        result.setSuccess(false);
        result.setFailedStage(stage);
        result.setStageReached(PipelineStage.FAILED);
        result.setError(message);
        result.setTotalProcessingTime(elapsedSeconds(started));
        log.error("[Pipeline] failed stage={} error={}", stage.code(), message);
        try {
            progress.onError(message, stage);
        } catch (RuntimeException e) {
            log.warn("[Pipeline] progress observer threw on error event: {}", e.toString());
        }
        return result;
    }

    private static void notify(ProgressObserver progress, ProgressStage stage, String message, boolean completed,
                               Map<String, Object> details) {
        try {
            progress.onProgress(stage, message, completed, details);
        } catch (RuntimeException e) {
            log.warn("[Pipeline] progress observer threw at stage={}: {}", stage.code(), e.toString());
        }
    }

    private static double elapsedSeconds(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000d;
    }
}
