package com.repolens.core.model;

import java.util.Objects;

/**
 * A weighted search term derived from a task prompt.
 *
 * @param term   lower-cased term; a multi-word phrase when {@code kind} is {@link Kind#PHRASE}
 * @param weight relative importance, always positive
 * @param kind   how the term was found in the prompt
 */
public record Keyword(String term, double weight, Kind kind) {

    public enum Kind {
        /** Ordinary prompt word. */
        WORD,
        /** camelCase or snake_case identifier, kept whole. */
        IDENTIFIER,
        /** Part of a split identifier. */
        SUBTOKEN,
        /** Quoted substring, matched verbatim. */
        PHRASE,
        /** Word with a known file extension, e.g. {@code login.py}. */
        FILE_NAME,
        /** Language name or extension, e.g. {@code python}. */
        LANGUAGE
    }

    public Keyword {
        Objects.requireNonNull(term, "term");
        Objects.requireNonNull(kind, "kind");
        if (term.isBlank()) {
            throw new IllegalArgumentException("Keyword term must not be blank");
        }
        if (!(weight > 0)) {
            throw new IllegalArgumentException("Keyword weight must be positive: " + weight);
        }
    }
}
