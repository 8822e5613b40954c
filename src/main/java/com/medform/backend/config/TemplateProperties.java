package com.medform.backend.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "medform.templates")
public class TemplateProperties {

    /**
     * Directories searched in order for template files. The bare file name is tried last.
     */
    private List<String> searchPaths = new ArrayList<>(List.of("templates", "src/main/resources/templates"));

    private String targetTemplate = "ash_medical_form.pdf";

    private String sourceTemplate = "mnr_form.pdf";

    /**
     * Load templates and cross-check the field-mapping tables at startup.
     */
    private boolean validateOnStartup = true;
}
