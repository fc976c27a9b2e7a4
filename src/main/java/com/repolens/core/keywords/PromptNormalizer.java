package com.repolens.core.keywords;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Whitespace and case normalisation of task prompts.
 */
public final class PromptNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PromptNormalizer() {}

    /**
     * Trims and collapses runs of whitespace to a single space. Case is kept
     * because identifier splitting needs it.
     */
    public static String normalize(String prompt) {
        if (prompt == null) {
            return "";
        }
        return WHITESPACE.matcher(prompt.strip()).replaceAll(" ");
    }

    /** {@link #normalize(String)} followed by case folding; the form hashed into cache keys. */
    public static String cacheForm(String prompt) {
        return normalize(prompt).toLowerCase(Locale.ROOT);
    }
}
