package com.medform.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Default pipeline options. Loaded from application.yml with prefix "medform.pipeline".
 *
 * Example:
 * medform.pipeline.extraction-method=auto
 * medform.pipeline.output-format=target_schema
 * medform.pipeline.output-directory=outputs
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "medform.pipeline")
public class PipelineProperties {

    /**
     * auto, vision or legacy_ocr.
     */
    @NotBlank
    private String extractionMethod = "auto";

    /**
     * Try the other registered extractor when the chosen one fails.
     */
    private boolean extractionFallback = true;

    /**
     * source_schema, target_schema or both.
     */
    @NotBlank
    private String outputFormat = "target_schema";

    private boolean enhancedFilling = true;

    private boolean saveIntermediate = false;

    @NotBlank
    private String outputDirectory = "outputs";

    private boolean includeMetadata = true;

    @Min(1)
    @Max(16)
    private int workerThreads = 4;
}
