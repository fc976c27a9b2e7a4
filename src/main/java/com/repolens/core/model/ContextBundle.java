package com.repolens.core.model;

import java.util.List;

/**
 * The engine's output: files selected for a prompt, in selection order.
 *
 * @param entries               selected files, highest score first
 * @param totalTokensEstimated  sum of the entries' estimated tokens
 * @param filesConsideredCount  scored files the selector looked at before stopping
 * @param filesDiscoveredCount  files the scanner found, including any it could not read in time
 * @param partial               true when the scan or mapping stopped early (timeout, read failures)
 */
public record ContextBundle(
    List<BundleEntry> entries,
    int totalTokensEstimated,
    int filesConsideredCount,
    int filesDiscoveredCount,
    boolean partial
) {
    public static final ContextBundle EMPTY = new ContextBundle(List.of(), 0, 0, 0, false);

    public ContextBundle {
        entries = List.copyOf(entries);
    }

    public List<String> paths() {
        return entries.stream().map(BundleEntry::path).toList();
    }

    public int fileCount() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Copy carrying the scan outcome. The selector only sees scored files; the
     * engine knows how many files were discovered and whether the scan finished.
     */
    public ContextBundle withScanOutcome(int discovered, boolean partialScan) {
        return new ContextBundle(entries, totalTokensEstimated, filesConsideredCount,
                Math.max(discovered, filesConsideredCount), partial || partialScan);
    }
}
