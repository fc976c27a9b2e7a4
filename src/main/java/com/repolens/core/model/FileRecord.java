package com.repolens.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One file discovered by the tree scanner.
 * <p>
 * Metadata is immutable. The content is attached once by the scanner worker that
 * read the file and is dropped again by {@link #discardContent()} after the
 * context bundle has been assembled, so large trees do not keep every file in
 * memory longer than one request.
 */
public final class FileRecord {

    private final String path;
    private final Language language;
    private final long sizeBytes;
    private final int depth;
    private final Instant lastModified;
    private final Path absolutePath;

    private volatile String content;

    /**
     * @param path         root-relative path, {@code /}-separated, never containing {@code ..}
     * @param language     language inferred from the file name
     * @param sizeBytes    size on disk
     * @param lastModified last modification time reported by the filesystem
     * @param absolutePath location on disk, used only for reading
     */
    public FileRecord(String path, Language language, long sizeBytes, Instant lastModified, Path absolutePath) {
        this.path = requireRelative(path);
        this.language = Objects.requireNonNull(language, "language");
        this.sizeBytes = sizeBytes;
        this.depth = path.split("/").length;
        this.lastModified = lastModified != null ? lastModified : Instant.EPOCH;
        this.absolutePath = absolutePath;
    }

    /** Creates a record whose content is already known (tests, in-memory trees). */
    public static FileRecord ofContent(String path, String content) {
        var record = new FileRecord(path, Language.fromFileName(fileNameOf(path)),
                content.length(), Instant.EPOCH, null);
        record.attachContent(content);
        return record;
    }

    public String path() {
        return path;
    }

    public Language language() {
        return language;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    /** Number of path segments, so a file at the root has depth 1. */
    public int depth() {
        return depth;
    }

    public Instant lastModified() {
        return lastModified;
    }

    public Path absolutePath() {
        return absolutePath;
    }

    /** File name without directories. */
    public String fileName() {
        return fileNameOf(path);
    }

    public Optional<String> content() {
        return Optional.ofNullable(content);
    }

    public boolean hasContent() {
        return content != null;
    }

    /**
     * Attaches the file content. Called once by the worker that read the file.
     *
     * @throws IllegalStateException if content was already attached
     */
    public void attachContent(String text) {
        if (this.content != null) {
            throw new IllegalStateException("Content already attached for " + path);
        }
        this.content = Objects.requireNonNull(text, "text");
    }

    public void discardContent() {
        this.content = null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileRecord other)) return false;
        return path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return "FileRecord[" + path + ", " + language.id() + ", " + sizeBytes + "B]";
    }

    private static String fileNameOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    private static String requireRelative(String path) {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty() || path.startsWith("/") || path.contains("\\")) {
            throw new IllegalArgumentException("Not a normalized relative path: " + path);
        }
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals("..") || segment.equals(".")) {
                throw new IllegalArgumentException("Not a normalized relative path: " + path);
            }
        }
        return path;
    }
}
