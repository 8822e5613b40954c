package com.medform.backend.services.forms.fill;

import java.nio.file.Path;
import java.util.Objects;

import com.medform.backend.services.forms.mapping.MappedForm;
import com.medform.backend.services.forms.template.FormTemplate;

public record FillRequest(MappedForm form, FormTemplate template, Path outputPath) {

    public FillRequest {
        Objects.requireNonNull(form, "form");
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(outputPath, "outputPath");
    }
}
