package com.repolens.core.scanner;

import com.repolens.core.model.Deadline;
import com.repolens.core.model.FileRecord;
import com.repolens.core.model.ScanOptions;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Derives a tree version for callers that do not know their commit: a SHA-256
 * over the sorted {@code (path, size, lastModified)} triples of every file a scan
 * with the same options would consider. No file content is read.
 * <p>
 * The walk shares the request deadline. A walk cut short by it yields no
 * fingerprint, since a hash over part of the tree would not identify the tree.
 */
public final class TreeFingerprint {

    private TreeFingerprint() {}

    /**
     * @return the fingerprint, or empty when {@code deadline} passed before the walk finished
     * @throws ScanException if the root is missing, not a directory or unreadable
     */
    public static Optional<String> compute(Path root, ScanOptions options, Deadline deadline) throws ScanException {
        Path realRoot = TreeWalk.resolveRoot(root);
        var discovery = TreeWalk.discover(realRoot, options, deadline);
        if (discovery.timedOut()) {
            return Optional.empty();
        }
        MessageDigest digest = sha256();
        for (FileRecord file : discovery.candidates()) {
            String line = file.path() + '\0' + file.sizeBytes() + '\0' + file.lastModified().toEpochMilli() + '\n';
            digest.update(line.getBytes(StandardCharsets.UTF_8));
        }
        return Optional.of("fp:" + HexFormat.of().formatHex(digest.digest()).substring(0, 16));
    }

    /** Stable repository identity for a root: its real path. */
    public static String identityOf(Path root) throws ScanException {
        return TreeWalk.resolveRoot(root).toString();
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
