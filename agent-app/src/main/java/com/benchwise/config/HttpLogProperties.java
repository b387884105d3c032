package com.benchwise.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * HTTP access log settings.
 */
@Data
@Component
@ConfigurationProperties(prefix = "observability.http-log", ignoreInvalidFields = true)
public class HttpLogProperties {

    private boolean enabled = true;

    private List<String> includePathPatterns = Arrays.asList("/api/**");

    private List<String> excludePathPatterns = Arrays.asList("/actuator/**");

    /** Requests slower than this are always logged. */
    private long slowRequestThresholdMs = 1000L;

    /** Sample rate between 0 and 1. */
    private double sampleRate = 1.0D;
}
