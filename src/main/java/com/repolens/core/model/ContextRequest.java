package com.repolens.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Everything the engine needs for one run.
 *
 * @param root               materialized working tree
 * @param repositoryIdentity stable repository name for caching; nullable, defaults to the root's real path
 * @param treeVersion        identifier of the tree state (commit hash, fingerprint); nullable, computed when absent
 * @param prompt             raw task prompt
 * @param budget             selection ceilings
 * @param maxFileSizeBytes   files larger than this are skipped by the scanner
 * @param excludePatterns    caller exclusion globs on top of the defaults
 * @param timeout            wall-clock limit for scanning and mapping; zero means none
 */
public record ContextRequest(
    Path root,
    String repositoryIdentity,
    String treeVersion,
    String prompt,
    ContextBudget budget,
    long maxFileSizeBytes,
    List<String> excludePatterns,
    Duration timeout
) {
    public ContextRequest {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(budget, "budget");
        prompt = prompt == null ? "" : prompt;
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        timeout = timeout == null ? Duration.ZERO : timeout;
        if (maxFileSizeBytes < 0) {
            throw new IllegalArgumentException("maxFileSizeBytes must be >= 0");
        }
    }

    public ScanOptions scanOptions() {
        return new ScanOptions(budget.maxDepth(), maxFileSizeBytes, excludePatterns);
    }

    public ContextRequest withIdentity(String identity, String version) {
        return new ContextRequest(root, identity, version, prompt, budget,
                maxFileSizeBytes, excludePatterns, timeout);
    }
}
