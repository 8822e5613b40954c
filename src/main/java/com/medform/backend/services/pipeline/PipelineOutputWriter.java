package com.medform.backend.services.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.medform.backend.services.forms.mapping.MappedForm;
import com.medform.backend.services.forms.normalize.NormalizedForm;
import com.medform.backend.services.forms.template.TargetFormat;

import lombok.extern.slf4j.Slf4j;

/**
 * Output file naming and the optional intermediate JSON dump.
 */
@Component
@Slf4j
public class PipelineOutputWriter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;
    private final ObjectMapper objectMapper;

    public PipelineOutputWriter(Clock clock, ObjectMapper objectMapper) {
        this.clock = clock;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * {@code <base>_<format>_filled_<yyyyMMdd_HHmmss>_<8 hex>.pdf} under {@code directory}.
     */
    public Path filledPdfPath(String directory, String baseName, TargetFormat format) {
        return Path.of(directory, baseName + "_" + format.code() + "_filled_" + timestamp() + "_" + shortId() + ".pdf");
    }

    public Path intermediatePath(String directory, String baseName) {
        return Path.of(directory, baseName + "_processed_" + timestamp() + "_" + shortId() + ".json");
    }

    public Path writeIntermediate(String directory, String baseName, NormalizedForm normalized,
                                  Map<TargetFormat, MappedForm> mapped) throws IOException {
        Map<String, Object> dump = new LinkedHashMap<>();
        dump.put("normalized", normalized == null ? null : normalized.toTree());
        Map<String, Object> mappedDump = new LinkedHashMap<>();
        mapped.forEach((format, form) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("fields", form.fields());
            entry.put("metadata", form.metadata() == null ? null : form.metadata().toMap());
            mappedDump.put(format.code(), entry);
        });
        dump.put("mapped", mappedDump);

        Path path = intermediatePath(directory, baseName);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        objectMapper.writeValue(path.toFile(), dump);
        log.info("[Pipeline] intermediate JSON written path={}", path);
        return path;
    }

    private String timestamp() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
