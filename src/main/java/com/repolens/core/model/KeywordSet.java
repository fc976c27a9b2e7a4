package com.repolens.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, ordered set of keywords extracted from one prompt.
 * <p>
 * Terms are unique. Ordering is by descending weight, then ascending term, so two
 * extractions of the same prompt compare equal.
 *
 * @param keywords      keywords ordered by descending weight
 * @param languageHints languages the prompt names explicitly
 */
public record KeywordSet(List<Keyword> keywords, Set<Language> languageHints) {

    private static final Comparator<Keyword> ORDER =
            Comparator.comparingDouble(Keyword::weight).reversed().thenComparing(Keyword::term);

    public static final KeywordSet EMPTY = new KeywordSet(List.of(), Set.of());

    public KeywordSet {
        var byTerm = new LinkedHashMap<String, Keyword>();
        for (Keyword keyword : keywords) {
            byTerm.merge(keyword.term(), keyword,
                    (existing, candidate) -> candidate.weight() > existing.weight() ? candidate : existing);
        }
        var ordered = new ArrayList<>(byTerm.values());
        ordered.sort(ORDER);
        keywords = List.copyOf(ordered);
        languageHints = languageHints.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(languageHints));
    }

    public boolean isEmpty() {
        return keywords.isEmpty();
    }

    public int size() {
        return keywords.size();
    }

    public List<String> terms() {
        return keywords.stream().map(Keyword::term).toList();
    }

    /** Term to weight, in keyword order. */
    public Map<String, Double> weights() {
        var weights = new LinkedHashMap<String, Double>();
        for (Keyword keyword : keywords) {
            weights.put(keyword.term(), keyword.weight());
        }
        return weights;
    }

    /**
     * Stable textual form used when hashing cache keys. Weights are rounded so the
     * fingerprint does not depend on floating-point formatting.
     */
    public String fingerprint() {
        var sb = new StringBuilder();
        for (Keyword keyword : keywords) {
            sb.append(keyword.term()).append('=').append(Math.round(keyword.weight() * 100)).append(';');
        }
        languageHints.stream().map(Language::id).sorted().forEach(id -> sb.append('@').append(id));
        return sb.toString();
    }
}
