package com.medform.backend.services.forms.template;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.pdmodel.interactive.form.PDNonTerminalField;
import org.springframework.stereotype.Component;

import com.medform.backend.config.TemplateProperties;
import com.medform.backend.services.cache.CacheStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds, loads and inspects the blank templates, one per {@link TargetFormat}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateRegistry {

    private final TemplateProperties properties;
    private final CacheStore cacheStore;

    private final Map<TargetFormat, FormTemplate> loaded = new ConcurrentHashMap<>();

    /**
     * Resolved location of the template, or empty when no candidate path exists.
     */
    public Optional<Path> locate(TargetFormat format) {
        String fileName = fileName(format);
        for (Path candidate : candidates(fileName)) {
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate.toAbsolutePath().normalize());
            }
        }
        return Optional.empty();
    }

    /**
     * Fails fast when any of the formats has no template on disk.
     */
    public void requireAll(Collection<TargetFormat> formats) {
        for (TargetFormat format : formats) {
            if (locate(format).isEmpty()) {
                throw missing(format);
            }
        }
    }

    public FormTemplate load(TargetFormat format) {
        return loaded.computeIfAbsent(format, this::readTemplate);
    }

    public Set<String> unmappedFields(TargetFormat format) {
        return load(format).unmappedFields();
    }

    /**
     * Loads every template that exists and logs the field-mapping cross-check. Missing templates are
     * reported, not thrown; the pipeline fails for them when they are actually requested.
     */
    public List<FormTemplate> warmUp() {
        List<FormTemplate> result = new ArrayList<>();
        for (TargetFormat format : TargetFormat.values()) {
            if (locate(format).isEmpty()) {
                log.warn("[Templates] {} template not found: {} (searched {})",
                        format.code(), fileName(format), properties.getSearchPaths());
                continue;
            }
            FormTemplate template = load(format);
            if (!template.unmappedFields().isEmpty()) {
                log.warn("[Templates] {} keys with no live PDF field: {}", format.code(), template.unmappedFields());
            }
            log.info("[Templates] {} ready path={} liveFields={} mappedKeys={}",
                    format.code(), template.path(), template.liveFieldNames().size(), template.table().size());
            result.add(template);
        }
        return result;
    }

    private FormTemplate readTemplate(TargetFormat format) {
        Path path = locate(format).orElseThrow(() -> missing(format));
        byte[] bytes;
        try {
            bytes = cacheStore.template(path.toString(), TemplateRegistry::readBytes);
        } catch (UncheckedIOException e) {
            throw new TemplateMissingException(format, "Template unreadable: " + path, e.getCause());
        }
        Set<String> live = liveFieldNames(bytes);
        FieldMappingTable table = format.table();
        return new FormTemplate(format, path, bytes, table, live, table.crossValidate(live));
    }

    /**
     * Fully qualified names of every terminal AcroForm field; empty for flat templates.
     */
    static Set<String> liveFieldNames(byte[] pdfBytes) {
        Set<String> names = new LinkedHashSet<>();
        try (PDDocument doc = PDDocument.load(pdfBytes)) {
            PDAcroForm form = doc.getDocumentCatalog().getAcroForm();
            if (form == null) return names;
            for (PDField field : form.getFieldTree()) {
                if (field instanceof PDNonTerminalField) continue;
                names.add(field.getFullyQualifiedName());
            }
        } catch (IOException e) {
            log.warn("[Templates] could not read AcroForm inventory: {}", e.getMessage());
        }
        return names;
    }

    private List<Path> candidates(String fileName) {
        List<Path> paths = new ArrayList<>();
        List<String> searchPaths = properties.getSearchPaths();
        if (searchPaths != null) {
            for (String dir : searchPaths) {
                if (dir != null && !dir.isBlank()) {
                    paths.add(Path.of(dir.trim(), fileName));
                }
            }
        }
        paths.add(Path.of(fileName));
        return paths;
    }

    private String fileName(TargetFormat format) {
        return format == TargetFormat.SOURCE_SCHEMA ? properties.getSourceTemplate() : properties.getTargetTemplate();
    }

    private TemplateMissingException missing(TargetFormat format) {
        return new TemplateMissingException(format,
                "Template for " + format.code() + " not found: " + fileName(format));
    }

    private static byte[] readBytes(String path) {
        try {
            return Files.readAllBytes(Path.of(path));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
