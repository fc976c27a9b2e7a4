package com.repolens.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ruby {@code require_relative} and {@code require}. Plain {@code require} names
 * resolve from the root or a {@code lib/} directory; gems are not in the tree.
 */
final class RubyImports implements ImportSyntax {

    private static final String RELATIVE_PREFIX = "./";

    private static final Pattern REQUIRE_RELATIVE = Pattern.compile(
            "^\\s*require_relative\\s*\\(?\\s*['\"]([^'\"]+)['\"]", Pattern.MULTILINE);
    private static final Pattern REQUIRE = Pattern.compile(
            "^\\s*require\\s*\\(?\\s*['\"]([^'\"]+)['\"]", Pattern.MULTILINE);

    @Override
    public List<String> references(String content) {
        var refs = new ArrayList<String>();
        Matcher m = REQUIRE_RELATIVE.matcher(content);
        while (m.find()) {
            String target = m.group(1);
            refs.add(target.startsWith(".") ? target : RELATIVE_PREFIX + target);
        }
        Matches.collect(REQUIRE, content, 1, refs);
        return Matches.distinct(refs);
    }

    @Override
    public Optional<String> resolve(String fromPath, String reference, KnownFiles known) {
        String file = reference.endsWith(".rb") ? reference : reference + ".rb";
        if (reference.startsWith(".")) {
            return KnownFiles.join(KnownFiles.directoryOf(fromPath), file).flatMap(p -> known.firstExisting(List.of(p)));
        }
        var candidates = new ArrayList<String>();
        KnownFiles.join("", file).ifPresent(candidates::add);
        KnownFiles.join("lib", file).ifPresent(candidates::add);
        Optional<String> direct = known.firstExisting(candidates);
        return direct.isPresent() ? direct : known.findBySuffix("lib/" + file);
    }
}
