package com.repolens.core.model;

import java.util.List;

/**
 * Caller-supplied limits for one tree scan.
 *
 * @param maxDepth         deepest path segment count a file may have
 * @param maxFileSizeBytes files larger than this are skipped
 * @param excludePatterns  glob patterns added to the default exclusions, matched
 *                         against root-relative paths and bare names
 */
public record ScanOptions(int maxDepth, long maxFileSizeBytes, List<String> excludePatterns) {

    public ScanOptions {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        if (maxFileSizeBytes < 0) throw new IllegalArgumentException("maxFileSizeBytes must be >= 0");
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }
}
