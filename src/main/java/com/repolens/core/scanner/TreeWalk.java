package com.repolens.core.scanner;

import com.repolens.core.model.Deadline;
import com.repolens.core.model.FileRecord;
import com.repolens.core.model.Language;
import com.repolens.core.model.ScanOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;

/**
 * Metadata-only walk shared by {@link TreeScanner} and {@link TreeFingerprint}.
 * Links are not followed; a link to a regular file inside the root is kept,
 * everything else reached through a link is excluded.
 */
final class TreeWalk {

    private static final Logger log = LoggerFactory.getLogger(TreeWalk.class);

    /** {@code timedOut} implies {@code partial}; the walk stopped at the deadline. */
    record Discovery(List<FileRecord> candidates, List<SkippedFile> skipped, boolean partial, boolean timedOut) {}

    private TreeWalk() {}

    static Path resolveRoot(Path root) throws ScanException {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }
        if (!Files.exists(root)) {
            throw new ScanException(root, "Scan root does not exist");
        }
        if (!Files.isDirectory(root)) {
            throw new ScanException(root, "Scan root is not a directory");
        }
        if (!Files.isReadable(root)) {
            throw new ScanException(root, "Scan root is not readable");
        }
        try {
            return root.toRealPath();
        } catch (IOException e) {
            throw new ScanException(root, "Cannot resolve scan root", e);
        }
    }

    static Discovery discover(Path realRoot, ScanOptions options, Deadline deadline) throws ScanException {
        var rules = ExclusionRules.withPatterns(options.excludePatterns());
        var visitor = new Visitor(realRoot, options, rules, deadline);
        try {
            Files.walkFileTree(realRoot, EnumSet.noneOf(FileVisitOption.class), options.maxDepth(), visitor);
        } catch (IOException e) {
            throw new ScanException(realRoot, "Failed to walk scan root", e);
        }
        visitor.candidates.sort(Comparator.comparing(FileRecord::path));
        return new Discovery(visitor.candidates, visitor.skipped, visitor.partial, visitor.timedOut);
    }

    static String relativePath(Path root, Path file) {
        var sb = new StringBuilder();
        for (Path segment : root.relativize(file)) {
            if (sb.length() > 0) sb.append('/');
            sb.append(segment);
        }
        return sb.toString();
    }

    private static final class Visitor extends SimpleFileVisitor<Path> {

        private final Path root;
        private final ScanOptions options;
        private final ExclusionRules rules;
        private final Deadline deadline;

        private final List<FileRecord> candidates = new ArrayList<>();
        private final List<SkippedFile> skipped = new ArrayList<>();
        private boolean partial;
        private boolean timedOut;

        Visitor(Path root, ScanOptions options, ExclusionRules rules, Deadline deadline) {
            this.root = root;
            this.options = options;
            this.rules = rules;
            this.deadline = deadline;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (dir.equals(root)) {
                return FileVisitResult.CONTINUE;
            }
            String name = dir.getFileName().toString();
            if (rules.excludesDirectory(relativePath(root, dir), name)) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (deadline.isExpired()) {
                log.warn("Scan deadline reached after {} candidate files", candidates.size());
                partial = true;
                timedOut = true;
                return FileVisitResult.TERMINATE;
            }
            if (attrs.isDirectory()) {
                // directory sitting exactly at the depth limit
                return FileVisitResult.CONTINUE;
            }
            String rel = relativePath(root, file);
            String name = file.getFileName().toString();
            if (rules.excludesFile(rel, name)) {
                skipped.add(new SkippedFile(rel, SkipReason.EXCLUDED));
                return FileVisitResult.CONTINUE;
            }

            Path readFrom = file;
            long size = attrs.size();
            if (attrs.isSymbolicLink()) {
                try {
                    Path target = file.toRealPath();
                    if (!target.startsWith(root) || !Files.isRegularFile(target)) {
                        skipped.add(new SkippedFile(rel, SkipReason.EXCLUDED, "link leaves the tree or is not a file"));
                        return FileVisitResult.CONTINUE;
                    }
                    readFrom = target;
                    size = Files.size(target);
                } catch (IOException e) {
                    skipped.add(new SkippedFile(rel, SkipReason.EXCLUDED, "dangling link"));
                    return FileVisitResult.CONTINUE;
                }
            } else if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }

            if (size > options.maxFileSizeBytes()) {
                log.debug("Skipping {} ({} bytes > {})", rel, size, options.maxFileSizeBytes());
                skipped.add(new SkippedFile(rel, SkipReason.TOO_LARGE, size + " bytes"));
                return FileVisitResult.CONTINUE;
            }

            candidates.add(new FileRecord(rel, Language.fromFileName(name), size,
                    attrs.lastModifiedTime().toInstant(), readFrom));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            String rel = relativePath(root, file);
            log.warn("Cannot access {}: {}", rel, exc.getMessage());
            skipped.add(new SkippedFile(rel, SkipReason.READ_ERROR, exc.getMessage()));
            partial = true;
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                log.warn("Directory listing of {} failed: {}", relativePath(root, dir), exc.getMessage());
                partial = true;
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
