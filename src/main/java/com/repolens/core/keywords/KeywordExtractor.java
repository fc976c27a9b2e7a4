package com.repolens.core.keywords;

import com.repolens.core.model.Keyword;
import com.repolens.core.model.KeywordSet;
import com.repolens.core.model.Language;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a weighted {@link KeywordSet} from a task prompt.
 * <p>
 * Weights, highest first: quoted phrases, file names with a known extension,
 * camelCase / snake_case identifiers, language names, programming vocabulary,
 * plain words, and the sub-tokens of split identifiers. Stop-words are removed
 * and terms shorter than three characters are dropped unless they are a known
 * acronym. The prompt is normalised first, so extracting from an already
 * normalised prompt yields the same set.
 */
public class KeywordExtractor {

    static final double PHRASE_WEIGHT = 3.0;
    static final double FILE_NAME_WEIGHT = 2.5;
    static final double IDENTIFIER_WEIGHT = 2.0;
    static final double LANGUAGE_WEIGHT = 1.5;
    static final double TECHNICAL_WEIGHT = 1.25;
    static final double WORD_WEIGHT = 1.0;
    static final double SUBTOKEN_WEIGHT = 0.75;

    /** Upper bound on terms kept per prompt; the lowest weighted are dropped. */
    static final int MAX_KEYWORDS = 50;

    private static final Pattern QUOTED = Pattern.compile(
            "\"([^\"]+)\"|`([^`]+)`|(?<![\\w])'([^']+)'(?![\\w])");
    private static final Pattern PATH_LIKE = Pattern.compile("[\\w./-]+");
    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9_]+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("[a-z0-9][A-Z]");
    private static final Pattern IDENTIFIER_SPLIT = Pattern.compile(
            "_+|(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])");

    public KeywordSet extract(String prompt) {
        String text = PromptNormalizer.normalize(prompt);
        if (text.isEmpty()) {
            return KeywordSet.EMPTY;
        }
        var keywords = new ArrayList<Keyword>();
        var hints = EnumSet.noneOf(Language.class);

        collectPhrases(text, keywords);
        collectFileNames(text, keywords, hints);
        collectTokens(text, keywords, hints);

        var extracted = new KeywordSet(keywords, hints);
        if (extracted.size() > MAX_KEYWORDS) {
            return new KeywordSet(extracted.keywords().subList(0, MAX_KEYWORDS), hints);
        }
        return extracted;
    }

    private static void collectPhrases(String text, List<Keyword> out) {
        Matcher m = QUOTED.matcher(text);
        while (m.find()) {
            String raw = m.group(1) != null ? m.group(1) : m.group(2) != null ? m.group(2) : m.group(3);
            String phrase = raw.strip().toLowerCase(Locale.ROOT);
            if (phrase.length() >= 2) {
                out.add(new Keyword(phrase, PHRASE_WEIGHT, Keyword.Kind.PHRASE));
            }
        }
    }

    private static void collectFileNames(String text, List<Keyword> out, Set<Language> hints) {
        Matcher m = PATH_LIKE.matcher(text);
        while (m.find()) {
            String candidate = trimPunctuation(m.group());
            int dot = candidate.lastIndexOf('.');
            if (dot <= 0 || dot == candidate.length() - 1 || candidate.contains("..")) {
                continue;
            }
            String extension = candidate.substring(dot + 1);
            Optional<Language> language = Language.fromExtension(extension);
            if (language.isEmpty()) {
                continue;
            }
            out.add(new Keyword(candidate.toLowerCase(Locale.ROOT), FILE_NAME_WEIGHT, Keyword.Kind.FILE_NAME));
            hints.add(language.get());
        }
    }

    private static void collectTokens(String text, List<Keyword> out, Set<Language> hints) {
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            String token = m.group();
            String lower = token.toLowerCase(Locale.ROOT);

            if (isIdentifier(token)) {
                if (keep(lower)) {
                    out.add(new Keyword(lower, IDENTIFIER_WEIGHT, Keyword.Kind.IDENTIFIER));
                }
                for (String part : IDENTIFIER_SPLIT.split(token)) {
                    String sub = part.toLowerCase(Locale.ROOT);
                    if (!sub.isEmpty() && keep(sub)) {
                        out.add(new Keyword(sub, SUBTOKEN_WEIGHT, Keyword.Kind.SUBTOKEN));
                    }
                }
                continue;
            }

            Optional<Language> language = Language.fromPromptWord(lower);
            if (language.isPresent()) {
                out.add(new Keyword(lower, LANGUAGE_WEIGHT, Keyword.Kind.LANGUAGE));
                hints.add(language.get());
                continue;
            }

            if (keep(lower)) {
                double weight = StopWords.TECHNICAL.contains(lower) ? TECHNICAL_WEIGHT : WORD_WEIGHT;
                out.add(new Keyword(lower, weight, Keyword.Kind.WORD));
            }
        }
    }

    static boolean isIdentifier(String token) {
        boolean snake = token.indexOf('_') > 0 && token.indexOf('_') < token.length() - 1;
        return snake || CAMEL_BOUNDARY.matcher(token).find();
    }

    private static boolean keep(String term) {
        if (StopWords.ENGLISH.contains(term)) {
            return false;
        }
        if (term.chars().allMatch(c -> c == '_')) {
            return false;
        }
        return term.length() >= 3 || StopWords.ACRONYMS.contains(term);
    }

    private static String trimPunctuation(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == '.' || s.charAt(start) == '-' || s.charAt(start) == '/')) start++;
        while (end > start && (s.charAt(end - 1) == '.' || s.charAt(end - 1) == '-' || s.charAt(end - 1) == '/')) end--;
        return s.substring(start, end);
    }
}
