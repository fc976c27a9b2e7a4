package com.repolens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One selected file inside a {@link ContextBundle}.
 *
 * @param path            root-relative path from the scan
 * @param language        inferred language
 * @param content         content, possibly cut at a line boundary
 * @param score           relevance score the file was selected with
 * @param estimatedTokens estimated tokens of {@code content}
 * @param truncated       true when {@code content} is shorter than the file
 * @param matchReasons    scoring signals, for diagnostics
 */
public record BundleEntry(
    String path,
    Language language,
    String content,
    double score,
    int estimatedTokens,
    boolean truncated,
    List<String> matchReasons
) {
    public BundleEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
        matchReasons = List.copyOf(matchReasons);
    }
}
