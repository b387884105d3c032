package com.benchwise.domain.agent.adapter.gateway;

import java.util.Optional;

/**
 * Chat-completion gateway used by the classifiers.
 *
 * @author benchwise
 * @since 2026-03-04
 */
public interface IModelGateway {

    /**
     * Whether a chat model is configured for this process.
     */
    boolean isAvailable();

    /**
     * Send a bounded prompt and return the raw completion text.
     * Returns empty when the model is unavailable, the call fails or times out.
     */
    Optional<String> complete(String prompt);
}
