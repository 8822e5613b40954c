package com.medform.backend.services.ai;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

@Configuration
@EnableConfigurationProperties(VisionProperties.class)
@Slf4j
public class VisionConfiguration {

    @Bean
    @ConditionalOnMissingBean(VisionModelClient.class)
    public VisionModelClient openAiVisionClient(VisionProperties visionProperties) {
        log.info("[Vision] enabled={} model='{}' apiKeyConfigured={} dpi={} timeoutSeconds={}",
                visionProperties.isEnabled(),
                visionProperties.getModel(),
                visionProperties.hasApiKey(),
                visionProperties.getRenderDpi(),
                visionProperties.getTimeoutSeconds());
        return new OpenAiVisionClient(visionProperties);
    }
}
