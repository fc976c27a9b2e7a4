package com.repolens.core.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Java, Kotlin and Scala {@code import} statements, including {@code import static}
 * and Scala selector groups. Wildcard imports name a package, not a file, and
 * are dropped.
 */
final class JvmImports implements ImportSyntax {

    private static final Pattern IMPORT = Pattern.compile(
            "^\\s*import\\s+(?:static\\s+)?([\\w.]+?)(\\.\\*|\\._|\\.\\{([^}]*)\\})?(?:\\s+as\\s+\\w+)?\\s*;?\\s*$", Pattern.MULTILINE);

    private static final List<String> EXTENSIONS = List.of(".java", ".kt", ".scala");

    @Override
    public List<String> references(String content) {
        var refs = new ArrayList<String>();
        Matcher m = IMPORT.matcher(content);
        while (m.find()) {
            String name = m.group(1);
            String tail = m.group(2);
            if (tail == null) {
                refs.add(name);
            } else if (m.group(3) != null) {
                for (String selector : m.group(3).split(",")) {
                    String simple = selector.strip().split("\\s|=>")[0];
                    if (!simple.isEmpty() && !simple.equals("_")) {
                        refs.add(name + "." + simple);
                    }
                }
            }
        }
        return Matches.distinct(refs);
    }

    @Override
    public Optional<String> resolve(String fromPath, String reference, KnownFiles known) {
        String[] segments = reference.split("\\.");
        var extensions = preferredExtensions(fromPath);
        // longest prefix first: drops member names of static imports and nested classes
        for (int length = segments.length; length >= 2; length--) {
            String base = String.join("/", Arrays.copyOf(segments, length));
            for (String ext : extensions) {
                Optional<String> match = known.findBySuffix(base + ext);
                if (match.isPresent()) {
                    return match;
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> preferredExtensions(String fromPath) {
        var ordered = new ArrayList<String>();
        for (String ext : EXTENSIONS) {
            if (fromPath.endsWith(ext) || (ext.equals(".kt") && fromPath.endsWith(".kts"))) {
                ordered.add(ext);
            }
        }
        for (String ext : EXTENSIONS) {
            if (!ordered.contains(ext)) {
                ordered.add(ext);
            }
        }
        return ordered;
    }
}
