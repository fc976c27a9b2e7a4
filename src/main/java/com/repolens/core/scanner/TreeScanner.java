package com.repolens.core.scanner;

import com.repolens.core.logging.MdcContext;
import com.repolens.core.model.Deadline;
import com.repolens.core.model.FileRecord;
import com.repolens.core.model.ScanOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Walks a working tree and reads the files a context request may use.
 * <p>
 * The walk itself is sequential and metadata-only. File contents are then read
 * on a bounded pool, one file per task, and collected in path order so the result
 * is deterministic regardless of which worker finished first. Reads still pending
 * when the deadline passes are abandoned and the result is flagged partial.
 */
public class TreeScanner {

    private static final Logger log = LoggerFactory.getLogger(TreeScanner.class);

    /** Bytes inspected for a NUL when deciding whether a file is binary. */
    static final int SNIFF_BYTES = 8000;

    /** Extra wait granted to a read already in progress when the deadline is near. */
    private static final Duration COLLECT_GRACE = Duration.ofMillis(50);

    private final ExecutorService readPool;

    public TreeScanner(ExecutorService readPool) {
        this.readPool = readPool;
    }

    /**
     * Scans without a deadline.
     *
     * @throws ScanException if the root is missing, not a directory or unreadable
     */
    public ScanResult scan(Path root, int maxDepth, long maxFileSize, List<String> excludePatterns)
            throws ScanException {
        return scan(root, new ScanOptions(maxDepth, maxFileSize, excludePatterns), Deadline.none());
    }

    /**
     * Scans {@code root}, stopping at {@code deadline}.
     *
     * @throws ScanException if the root is missing, not a directory or unreadable
     */
    public ScanResult scan(Path root, ScanOptions options, Deadline deadline) throws ScanException {
        Path realRoot = TreeWalk.resolveRoot(root);
        var discovery = TreeWalk.discover(realRoot, options, deadline);
        var candidates = discovery.candidates();
        var skipped = new ArrayList<>(discovery.skipped());
        boolean partial = discovery.partial();

        var futures = new ArrayList<Future<SkippedFile>>(candidates.size());
        for (FileRecord candidate : candidates) {
            futures.add(readPool.submit(MdcContext.propagate(() -> read(candidate, deadline))));
        }

        var files = new ArrayList<FileRecord>(candidates.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            FileRecord candidate = candidates.get(i);
            Future<SkippedFile> future = futures.get(i);
            if (interrupted) {
                future.cancel(true);
                skipped.add(new SkippedFile(candidate.path(), SkipReason.TIMEOUT, "interrupted"));
                continue;
            }
            try {
                long waitMs = Math.max(deadline.remaining().toMillis(), COLLECT_GRACE.toMillis());
                SkippedFile skip = future.get(waitMs, TimeUnit.MILLISECONDS);
                if (skip == null) {
                    files.add(candidate);
                } else {
                    skipped.add(skip);
                    partial |= skip.reason().degradesResult();
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                skipped.add(new SkippedFile(candidate.path(), SkipReason.TIMEOUT));
                partial = true;
            } catch (ExecutionException e) {
                log.warn("Reading {} failed: {}", candidate.path(), e.getCause().toString());
                skipped.add(new SkippedFile(candidate.path(), SkipReason.READ_ERROR, e.getCause().getMessage()));
                partial = true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                partial = true;
                future.cancel(true);
                skipped.add(new SkippedFile(candidate.path(), SkipReason.TIMEOUT, "interrupted"));
            }
        }

        if (partial) {
            log.warn("Partial scan of {}: {} of {} candidate files read", realRoot, files.size(), candidates.size());
        } else {
            log.debug("Scanned {}: {} files read, {} skipped", realRoot, files.size(), skipped.size());
        }
        return new ScanResult(files, skipped, candidates.size(), partial);
    }

    /**
     * Reads one file and attaches its content.
     *
     * @return {@code null} when the content was attached, otherwise why it was not
     */
    private static SkippedFile read(FileRecord record, Deadline deadline) {
        if (deadline.isExpired()) {
            return new SkippedFile(record.path(), SkipReason.TIMEOUT);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(record.absolutePath());
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", record.path(), e.getMessage());
            return new SkippedFile(record.path(), SkipReason.READ_ERROR, e.getMessage());
        }
        if (looksBinary(bytes)) {
            log.debug("Skipping binary file {}", record.path());
            return new SkippedFile(record.path(), SkipReason.BINARY);
        }
        record.attachContent(new String(bytes, StandardCharsets.UTF_8));
        return null;
    }

    static boolean looksBinary(byte[] bytes) {
        int limit = Math.min(bytes.length, SNIFF_BYTES);
        for (int i = 0; i < limit; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }
}
