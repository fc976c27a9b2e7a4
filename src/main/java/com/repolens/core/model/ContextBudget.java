package com.repolens.core.model;

/**
 * Hard ceilings for one context request.
 *
 * @param maxTokens       estimated token total the bundle may not exceed
 * @param maxFiles        number of files the bundle may not exceed
 * @param maxCharsPerFile characters of content kept per file
 * @param maxDepth        path segments below the root the scanner descends to
 */
public record ContextBudget(int maxTokens, int maxFiles, int maxCharsPerFile, int maxDepth) {

    public ContextBudget {
        if (maxTokens < 0) throw new IllegalArgumentException("maxTokens must be >= 0");
        if (maxFiles < 0) throw new IllegalArgumentException("maxFiles must be >= 0");
        if (maxCharsPerFile < 0) throw new IllegalArgumentException("maxCharsPerFile must be >= 0");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
    }
}
