package com.medform.backend.services.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.medform.backend.services.extraction.ExtractionResult;
import com.medform.backend.services.forms.fill.FillingResult;
import com.medform.backend.services.forms.mapping.MappedForm;
import com.medform.backend.services.forms.normalize.NormalizedForm;
import com.medform.backend.services.forms.template.OutputFormat;
import com.medform.backend.services.forms.template.TargetFormat;

import lombok.Builder;
import lombok.Data;

/**
 * Everything one run produced, including partial results when it stopped early.
 */
@Data
@Builder
public class PipelineResult {

    private boolean success;
    private PipelineStage stageReached;
    /** Stage that was running when the run failed; null on success. */
    private PipelineStage failedStage;
    private String error;

    private OutputFormat outputFormat;
    private ExtractionResult extractionResult;
    private NormalizedForm normalizedForm;

    @Builder.Default
    private Map<TargetFormat, MappedForm> mappedForms = new EnumMap<>(TargetFormat.class);
    @Builder.Default
    private Map<TargetFormat, FillingResult> fillingResults = new EnumMap<>(TargetFormat.class);

    private double totalCost;
    private double totalProcessingTime;
    private Path intermediatePath;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Fill result of the first requested format.
     */
    public FillingResult getFillingResult() {
        return outputFormat == null ? null : fillingResults.get(outputFormat.formats().get(0));
    }

    /**
     * Fill result of the second format in dual-output runs, otherwise null.
     */
    public FillingResult getSecondaryFillingResult() {
        if (outputFormat == null || !outputFormat.isDual()) return null;
        return fillingResults.get(outputFormat.formats().get(1));
    }

    public MappedForm getMappedForm() {
        return outputFormat == null ? null : mappedForms.get(outputFormat.formats().get(0));
    }

    public List<Path> outputPaths() {
        List<Path> paths = new ArrayList<>();
        for (FillingResult r : fillingResults.values()) {
            if (r.success() && r.outputPath() != null) paths.add(r.outputPath());
        }
        return paths;
    }
}
