package com.medform.backend.services.forms.template;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.medform.backend.config.TemplateProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateStartupValidation implements ApplicationRunner {

    private final TemplateProperties properties;
    private final TemplateRegistry registry;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isValidateOnStartup()) {
            log.info("[Templates] startup validation disabled (medform.templates.validate-on-startup=false)");
            return;
        }
        int ready = registry.warmUp().size();
        log.info("[Templates] {}/{} templates available", ready, TargetFormat.values().length);
    }
}
