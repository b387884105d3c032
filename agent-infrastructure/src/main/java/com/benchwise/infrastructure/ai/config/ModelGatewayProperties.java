package com.benchwise.infrastructure.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Model gateway settings.
 *
 * @author benchwise
 * @since 2026-03-08
 */
@Data
@ConfigurationProperties(prefix = "model-gateway")
public class ModelGatewayProperties {

    /**
     * When false every classifier runs on its rule-based path.
     */
    private boolean enabled = true;

    /**
     * Per-call timeout in milliseconds.
     */
    private long timeoutMs = 60000L;

    /**
     * Concurrent model calls allowed across all executions.
     */
    private int maxConcurrency = 4;

    /**
     * Document text is truncated to this many characters before prompting.
     */
    private int maxDocumentChars = 4000;

    /**
     * Optional model override. Blank uses the provider default.
     */
    private String model;

    private Double temperature = 0.1D;
}
