package com.repolens.core.scanner;

import com.repolens.core.model.FileRecord;

import java.util.List;

/**
 * Outcome of one tree scan.
 *
 * @param files           records with content attached, in ascending path order
 * @param skipped         files left out, with the reason
 * @param discoveredCount candidate files found by the walk (after exclusion and size rules)
 * @param partial         true when the deadline passed or a file could not be read
 */
public record ScanResult(List<FileRecord> files, List<SkippedFile> skipped, int discoveredCount, boolean partial) {

    public ScanResult {
        files = List.copyOf(files);
        skipped = List.copyOf(skipped);
    }

    public long skippedCount(SkipReason reason) {
        return skipped.stream().filter(s -> s.reason() == reason).count();
    }
}
