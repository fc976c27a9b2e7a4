package com.repolens.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * C and C++ {@code #include} directives, quoted and angle-bracketed. Includes are
 * looked up next to the including file, then from the root, then by suffix
 * (for {@code include/} directories).
 */
final class CIncludes implements ImportSyntax {

    private static final Pattern INCLUDE = Pattern.compile("^\\s*#\\s*include\\s*[<\"]([^>\"]+)[>\"]", Pattern.MULTILINE);

    @Override
    public List<String> references(String content) {
        var refs = new ArrayList<String>();
        Matches.collect(INCLUDE, content, 1, refs);
        return Matches.distinct(refs);
    }

    @Override
    public Optional<String> resolve(String fromPath, String reference, KnownFiles known) {
        var candidates = new ArrayList<String>();
        KnownFiles.join(KnownFiles.directoryOf(fromPath), reference).ifPresent(candidates::add);
        KnownFiles.join("", reference).ifPresent(candidates::add);
        Optional<String> direct = known.firstExisting(candidates);
        if (direct.isPresent() || reference.contains("..")) {
            return direct;
        }
        return known.findBySuffix(reference);
    }
}
