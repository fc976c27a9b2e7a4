package com.repolens.core.graph;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class Matches {

    private Matches() {}

    /** Adds every non-null capture of {@code group} to {@code out}. */
    static void collect(Pattern pattern, String content, int group, Collection<String> out) {
        Matcher m = pattern.matcher(content);
        while (m.find()) {
            String value = m.group(group);
            if (value != null && !value.isBlank()) {
                out.add(value.strip());
            }
        }
    }

    static List<String> distinct(Collection<String> values) {
        return List.copyOf(new LinkedHashSet<>(values));
    }
}
