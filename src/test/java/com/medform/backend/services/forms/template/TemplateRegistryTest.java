package com.medform.backend.services.forms.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.medform.backend.config.CacheProperties;
import com.medform.backend.config.TemplateProperties;
import com.medform.backend.services.cache.CacheStore;
import com.medform.backend.services.forms.schema.AshSchema;
import com.medform.backend.support.MutableClock;
import com.medform.backend.support.TestPdfs;

class TemplateRegistryTest {

    @TempDir
    Path dir;

    private CacheStore cacheStore;
    private TemplateRegistry registry;

    @BeforeEach
    void setUp() {
        TemplateProperties properties = new TemplateProperties();
        properties.setSearchPaths(List.of(dir.resolve("missing").toString(), dir.toString()));
        cacheStore = new CacheStore(new MutableClock(Instant.parse("2026-01-01T00:00:00Z")), new CacheProperties());
        registry = new TemplateRegistry(properties, cacheStore);
    }

    @Test
    void locate_searchesConfiguredDirectoriesInOrder() throws Exception {
        Files.write(dir.resolve("ash_medical_form.pdf"), TestPdfs.textPdf("Weight"));

        assertEquals(dir.resolve("ash_medical_form.pdf").toAbsolutePath().normalize(),
                registry.locate(TargetFormat.TARGET_SCHEMA).orElseThrow());
        assertTrue(registry.locate(TargetFormat.SOURCE_SCHEMA).isEmpty());
    }

    @Test
    void requireAll_missingTemplateNamesTheFormat() throws Exception {
        Files.write(dir.resolve("ash_medical_form.pdf"), TestPdfs.textPdf("Weight"));

        TemplateMissingException e = assertThrows(TemplateMissingException.class,
                () -> registry.requireAll(OutputFormat.BOTH.formats()));

        assertEquals(TargetFormat.SOURCE_SCHEMA, e.getFormat());
        assertTrue(e.getMessage().contains("mnr_form.pdf"));
    }

    @Test
    void load_acroFormTemplateCrossValidated() throws Exception {
        Files.write(dir.resolve("ash_medical_form.pdf"),
                TestPdfs.acroFormPdf(List.of("PCP Name", "Weight", "Pain Level")));

        FormTemplate template = registry.load(TargetFormat.TARGET_SCHEMA);

        assertTrue(template.hasNativeFields());
        assertEquals(3, template.liveFieldNames().size());
        assertFalse(template.unmappedFields().contains(AshSchema.WEIGHT));
        assertTrue(template.unmappedFields().contains(AshSchema.HEIGHT));
        assertEquals(template.unmappedFields(), registry.unmappedFields(TargetFormat.TARGET_SCHEMA));
        assertSame(template, registry.load(TargetFormat.TARGET_SCHEMA));
        assertEquals(1, cacheStore.templateCount());
    }

    @Test
    void load_flatTemplateHasNoNativeFields() throws Exception {
        Files.write(dir.resolve("mnr_form.pdf"), TestPdfs.textPdf("Primary Care Physician:", "Weight:"));

        FormTemplate template = registry.load(TargetFormat.SOURCE_SCHEMA);

        assertFalse(template.hasNativeFields());
        assertTrue(template.unmappedFields().isEmpty());
    }

    @Test
    void warmUp_skipsMissingTemplates() throws Exception {
        Files.write(dir.resolve("mnr_form.pdf"), TestPdfs.textPdf("Weight:"));

        List<FormTemplate> ready = registry.warmUp();

        assertEquals(1, ready.size());
        assertEquals(TargetFormat.SOURCE_SCHEMA, ready.get(0).format());
    }
}
