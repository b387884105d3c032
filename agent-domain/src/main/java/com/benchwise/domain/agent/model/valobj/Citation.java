package com.benchwise.domain.agent.model.valobj;

/**
 * Source reference attached to an agent output.
 */
public record Citation(String title, String reference, String url) {
}
