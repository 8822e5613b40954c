package com.medform.backend.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "medform.cache")
public class CacheProperties {

    /**
     * How long an extraction result stays reusable.
     */
    private Duration ttl = Duration.ofMinutes(30);

    /**
     * CONTENT shares entries between requesters with identical document bytes,
     * REQUESTER additionally partitions entries by caller identity.
     */
    private Scope scope = Scope.REQUESTER;

    public enum Scope {
        CONTENT,
        REQUESTER
    }
}
