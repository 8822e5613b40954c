package com.medform.backend.services.forms.fill;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.medform.backend.services.fallback.FallbackChain;
import com.medform.backend.services.forms.mapping.MappedForm;
import com.medform.backend.services.forms.template.FormTemplate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Tries the fill strategies in cascade order; the first that fills anything wins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfFillEngine {

    private final StructuredFieldFillStrategy structured;
    private final BasicFieldFillStrategy basic;
    private final OverlayFillStrategy overlay;

    public FillingResult fill(MappedForm form, FormTemplate template, Path outputPath, boolean enhancedFilling) {
        if (form == null || form.isEmpty()) {
            return FillingResult.failure(FillMethod.ALL_FAILED, "No mapped values to fill", List.of());
        }
        FillRequest request = new FillRequest(form, template, outputPath);
        List<String> warnings = new ArrayList<>();

        FallbackChain.Builder<FillingResult> chain = FallbackChain
                .<FillingResult>builder("Fill", FillingResult::success)
                .failureReason(r -> {
                    warnings.addAll(r.warnings());
                    return r.error();
                });
        for (FillStrategy strategy : order(enhancedFilling)) {
            chain.attempt(strategy.method().code(), () -> strategy.fill(request));
        }

        log.info("[Fill] {} template={} values={} enhanced={}",
                template.format().code(), template.path(), form.size(), enhancedFilling);
        FallbackChain.Outcome<FillingResult> outcome = chain.build().run();
        if (outcome.succeeded()) {
            FillingResult winner = outcome.result();
            warnings.addAll(outcome.failures());
            warnings.addAll(winner.warnings());
            return winner.withWarnings(warnings);
        }

        warnings.addAll(outcome.failures());
        log.error("[Fill] all fill methods failed for {}: {}", template.format().code(), outcome.failures());
        return FillingResult.failure(FillMethod.ALL_FAILED,
                "All fill methods failed: " + String.join("; ", outcome.failures()), warnings);
    }

    List<FillStrategy> order(boolean enhancedFilling) {
        return enhancedFilling
                ? List.of(structured, basic, overlay)
                : List.of(basic, structured, overlay);
    }
}
