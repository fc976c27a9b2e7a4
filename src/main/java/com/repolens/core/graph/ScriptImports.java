package com.repolens.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * JavaScript and TypeScript: {@code import ... from}, side-effect imports,
 * {@code export ... from}, {@code require()} and dynamic {@code import()}.
 * Only relative specifiers resolve; bare package names point outside the tree.
 */
final class ScriptImports implements ImportSyntax {

    private static final Pattern STATIC_IMPORT = Pattern.compile(
            "^\\s*(?:import|export)\\s+(?:[^'\";]*?\\s+from\\s+)?['\"]([^'\"]+)['\"]", Pattern.MULTILINE);
    private static final Pattern REQUIRE = Pattern.compile("\\brequire\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");
    private static final Pattern DYNAMIC_IMPORT = Pattern.compile("\\bimport\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    private static final List<String> EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs");

    @Override
    public List<String> references(String content) {
        var refs = new ArrayList<String>();
        Matches.collect(STATIC_IMPORT, content, 1, refs);
        Matches.collect(REQUIRE, content, 1, refs);
        Matches.collect(DYNAMIC_IMPORT, content, 1, refs);
        return Matches.distinct(refs);
    }

    @Override
    public Optional<String> resolve(String fromPath, String reference, KnownFiles known) {
        if (!reference.startsWith(".") && !reference.startsWith("/")) {
            return Optional.empty();
        }
        Optional<String> joined = KnownFiles.join(KnownFiles.directoryOf(fromPath), reference);
        if (joined.isEmpty()) {
            return Optional.empty();
        }
        String target = joined.get();
        var candidates = new ArrayList<String>();
        candidates.add(target);
        if (target.endsWith(".js")) {
            // TypeScript sources import their compiled names
            String stem = target.substring(0, target.length() - 3);
            candidates.add(stem + ".ts");
            candidates.add(stem + ".tsx");
        }
        for (String ext : EXTENSIONS) {
            candidates.add(target + ext);
        }
        for (String ext : EXTENSIONS) {
            candidates.add(target + "/index" + ext);
        }
        return known.firstExisting(candidates);
    }
}
