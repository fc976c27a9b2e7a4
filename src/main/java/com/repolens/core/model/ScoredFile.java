package com.repolens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A file with its relevance score for one request.
 *
 * @param file         the scanned file
 * @param score        non-negative relevance score
 * @param matched      true when the file matched a keyword or was reached from a matching file
 *                     through the import graph; false when only priors scored it
 * @param matchReasons signals that contributed to the score, for diagnostics
 */
public record ScoredFile(FileRecord file, double score, boolean matched, List<String> matchReasons) {

    public ScoredFile {
        Objects.requireNonNull(file, "file");
        if (score < 0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("Score must be non-negative: " + score);
        }
        matchReasons = List.copyOf(matchReasons);
    }

    public ScoredFile(FileRecord file, double score, List<String> matchReasons) {
        this(file, score, true, matchReasons);
    }

    public String path() {
        return file.path();
    }
}
