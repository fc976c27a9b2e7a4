package com.repolens.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Go single-line and block imports. A Go import names a package directory and
 * resolves to that directory's first non-test {@code .go} file. Imports under a
 * module declared by a scanned {@code go.mod} map onto the module's directory;
 * other imports fall back to the longest known directory that is a suffix of the
 * import path with at least two segments.
 */
final class GoImports implements ImportSyntax {

    private static final Pattern SINGLE = Pattern.compile("^\\s*import\\s+(?:[\\w.]+\\s+)?\"([^\"]+)\"", Pattern.MULTILINE);
    private static final Pattern BLOCK = Pattern.compile("^\\s*import\\s*\\(([^)]*)\\)", Pattern.MULTILINE);
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    @Override
    public List<String> references(String content) {
        var refs = new ArrayList<String>();
        Matches.collect(SINGLE, content, 1, refs);
        Matcher block = BLOCK.matcher(content);
        while (block.find()) {
            Matches.collect(QUOTED, block.group(1), 1, refs);
        }
        return Matches.distinct(refs);
    }

    @Override
    public Optional<String> resolve(String fromPath, String reference, KnownFiles known) {
        if (reference.startsWith(".")) {
            return KnownFiles.join(KnownFiles.directoryOf(fromPath), reference)
                    .flatMap(dir -> firstSource(dir, known));
        }
        Optional<String> inModule = known.goPackageDirectory(reference).flatMap(dir -> firstSource(dir, known));
        if (inModule.isPresent()) {
            return inModule;
        }
        // at least two segments, so "errors" or "net/http" never land on a local errors/ or http/ directory
        String[] segments = reference.split("/");
        for (int start = 0; start < segments.length - 1; start++) {
            String suffix = String.join("/", List.of(segments).subList(start, segments.length));
            for (String dir : known.directoriesEndingWith(suffix)) {
                Optional<String> source = firstSource(dir, known);
                if (source.isPresent()) {
                    return source;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> firstSource(String directory, KnownFiles known) {
        for (String path : known.filesIn(directory)) {
            if (path.endsWith(".go") && !path.endsWith("_test.go")) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }
}
