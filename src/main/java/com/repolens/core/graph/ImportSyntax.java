package com.repolens.core.graph;

import java.util.List;
import java.util.Optional;

/**
 * Import statement rules for one language group.
 * <p>
 * Implementations are pure: they see file text and the index of scanned paths,
 * never the filesystem. A reference that cannot be resolved yields an empty
 * result and is dropped by the mapper.
 */
public interface ImportSyntax {

    /** Module or path references in {@code content}, in order of appearance. */
    List<String> references(String content);

    /**
     * Resolves one reference made by {@code fromPath} to a scanned path.
     * Resolution order is relative path, then extension suffixes, then an
     * index or module-root file for directory-style references.
     */
    Optional<String> resolve(String fromPath, String reference, KnownFiles known);
}
