package com.repolens.core.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code import a.b}, {@code import a, b}, {@code from a.b import c} and relative
 * {@code from ..pkg import x}. A {@code from} import yields both the module and
 * each imported name as a submodule, since either may be a file.
 */
final class PythonImports implements ImportSyntax {

    private static final Pattern FROM_IMPORT = Pattern.compile(
            "^\\s*from\\s+(\\.*[\\w.]*)\\s+import\\s+(?:\\(([^)]*)\\)|([\\w \\t,*]+))", Pattern.MULTILINE);
    private static final Pattern PLAIN_IMPORT = Pattern.compile(
            "^\\s*import\\s+([\\w.]+(?:\\s+as\\s+\\w+)?(?:\\s*,\\s*[\\w.]+(?:\\s+as\\s+\\w+)?)*)", Pattern.MULTILINE);

    @Override
    public List<String> references(String content) {
        var refs = new ArrayList<String>();
        Matcher m = FROM_IMPORT.matcher(content);
        while (m.find()) {
            String module = m.group(1);
            String names = m.group(2) != null ? m.group(2) : m.group(3);
            for (String name : names.split(",")) {
                String imported = name.strip().split("\\s+")[0];
                if (imported.isEmpty() || imported.equals("*")) {
                    continue;
                }
                refs.add(module.endsWith(".") ? module + imported : module + "." + imported);
            }
            if (!module.chars().allMatch(c -> c == '.')) {
                refs.add(module);
            }
        }
        m = PLAIN_IMPORT.matcher(content);
        while (m.find()) {
            for (String part : m.group(1).split(",")) {
                refs.add(part.strip().split("\\s+")[0]);
            }
        }
        return Matches.distinct(refs);
    }

    @Override
    public Optional<String> resolve(String fromPath, String reference, KnownFiles known) {
        int dots = 0;
        while (dots < reference.length() && reference.charAt(dots) == '.') {
            dots++;
        }
        String modulePath = reference.substring(dots).replace('.', '/');
        if (modulePath.isEmpty()) {
            return Optional.empty();
        }

        var candidates = new ArrayList<String>();
        if (dots > 0) {
            String base = KnownFiles.directoryOf(fromPath);
            for (int i = 1; i < dots; i++) {
                base = base.isEmpty() ? null : KnownFiles.directoryOf(base);
                if (base == null) {
                    return Optional.empty();
                }
            }
            addModuleCandidates(base, modulePath, candidates);
            return known.firstExisting(candidates);
        }

        addModuleCandidates("", modulePath, candidates);
        addModuleCandidates(KnownFiles.directoryOf(fromPath), modulePath, candidates);
        Optional<String> direct = known.firstExisting(candidates);
        if (direct.isPresent()) {
            return direct;
        }
        Optional<String> nested = known.findBySuffix(modulePath + ".py");
        return nested.isPresent() ? nested : known.findBySuffix(modulePath + "/__init__.py");
    }

    private static void addModuleCandidates(String base, String modulePath, List<String> out) {
        KnownFiles.join(base, modulePath + ".py").ifPresent(out::add);
        KnownFiles.join(base, modulePath + "/__init__.py").ifPresent(out::add);
    }
}
