package com.repolens.core.selection;

/**
 * Approximate token counts for model context budgeting.
 * <p>
 * Prose averages about four characters per token; punctuation-heavy code
 * tokenises denser, down to three characters per token once a quarter of the
 * characters are symbols. Counts are rounded up so callers err toward
 * including slightly less than a real tokenizer would allow.
 */
public class TokenEstimator {

    static final double PROSE_CHARS_PER_TOKEN = 4.0;
    static final double DENSE_CHARS_PER_TOKEN = 3.0;
    static final double DENSE_SYMBOL_RATIO = 0.25;

    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return estimate(text.length(), countSymbols(text, 0, text.length()));
    }

    /** Estimate from precomputed counts, for incremental prefix scans. */
    static int estimate(int length, int symbols) {
        if (length == 0) {
            return 0;
        }
        double density = (double) symbols / length;
        double charsPerToken = PROSE_CHARS_PER_TOKEN
                - (PROSE_CHARS_PER_TOKEN - DENSE_CHARS_PER_TOKEN) * Math.min(1.0, density / DENSE_SYMBOL_RATIO);
        return (int) Math.ceil(length / charsPerToken);
    }

    static int countSymbols(String text, int from, int to) {
        int symbols = 0;
        for (int i = from; i < to; i++) {
            if (isSymbol(text.charAt(i))) {
                symbols++;
            }
        }
        return symbols;
    }

    static boolean isSymbol(char c) {
        return !Character.isLetterOrDigit(c) && !Character.isWhitespace(c);
    }
}
