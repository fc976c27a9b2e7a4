package com.repolens.core.selection;

/**
 * Cuts file content at line boundaries so a truncated file never ends in the
 * middle of a statement. A kept prefix always ends with its newline; when not
 * even the first line fits the result is empty.
 */
public final class LineTruncator {

    private LineTruncator() {}

    /** Longest whole-line prefix of at most {@code maxChars} characters. */
    public static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        if (maxChars <= 0) {
            return "";
        }
        int newline = text.lastIndexOf('\n', maxChars - 1);
        return newline < 0 ? "" : text.substring(0, newline + 1);
    }

    /** Longest whole-line prefix whose estimate is at most {@code maxTokens}. */
    public static String truncateToTokens(String text, int maxTokens) {
        if (TokenEstimator.estimate(text.length(), TokenEstimator.countSymbols(text, 0, text.length())) <= maxTokens) {
            return text;
        }
        int best = 0;
        int symbols = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (TokenEstimator.isSymbol(c)) {
                symbols++;
            }
            if (c == '\n') {
                int length = i + 1;
                if (length > maxTokens * TokenEstimator.PROSE_CHARS_PER_TOKEN) {
                    // no estimate can fit past this length
                    break;
                }
                if (TokenEstimator.estimate(length, symbols) <= maxTokens) {
                    best = length;
                }
            }
        }
        return text.substring(0, best);
    }
}
