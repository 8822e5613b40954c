package com.medform.backend.services.pipeline;

import com.medform.backend.config.PipelineProperties;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-run options. Defaults come from {@link PipelineProperties}; callers override per request.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PipelineConfig {

    @Builder.Default
    private String extractionMethod = "auto";

    @Builder.Default
    private boolean extractionFallback = true;

    @Builder.Default
    private String outputFormat = "target_schema";

    @Builder.Default
    private boolean enhancedFilling = true;

    private boolean saveIntermediate;

    @Builder.Default
    private String outputDirectory = "outputs";

    @Builder.Default
    private boolean includeMetadata = true;

    /** Caller identity, used for cache partitioning and reported in metadata only. */
    private String userId;

    private String sessionId;

    public static PipelineConfig fromProperties(PipelineProperties properties) {
        return PipelineConfig.builder()
                .extractionMethod(properties.getExtractionMethod())
                .extractionFallback(properties.isExtractionFallback())
                .outputFormat(properties.getOutputFormat())
                .enhancedFilling(properties.isEnhancedFilling())
                .saveIntermediate(properties.isSaveIntermediate())
                .outputDirectory(properties.getOutputDirectory())
                .includeMetadata(properties.isIncludeMetadata())
                .build();
    }
}
