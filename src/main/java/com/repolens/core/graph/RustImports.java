package com.repolens.core.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rust {@code mod name;} declarations and {@code use crate::}, {@code use super::}
 * and {@code use self::} paths. External crates are not part of the tree.
 */
final class RustImports implements ImportSyntax {

    private static final String MOD_PREFIX = "mod:";

    private static final Pattern MOD = Pattern.compile(
            "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?mod\\s+(\\w+)\\s*;", Pattern.MULTILINE);
    private static final Pattern USE = Pattern.compile(
            "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?use\\s+((?:crate|super|self)(?:::\\w+)+)", Pattern.MULTILINE);

    private static final List<String> CRATE_ROOTS = List.of("lib.rs", "main.rs", "mod.rs");

    @Override
    public List<String> references(String content) {
        var refs = new ArrayList<String>();
        Matcher m = MOD.matcher(content);
        while (m.find()) {
            refs.add(MOD_PREFIX + m.group(1));
        }
        Matches.collect(USE, content, 1, refs);
        return Matches.distinct(refs);
    }

    @Override
    public Optional<String> resolve(String fromPath, String reference, KnownFiles known) {
        if (reference.startsWith(MOD_PREFIX)) {
            String name = reference.substring(MOD_PREFIX.length());
            return known.firstExisting(moduleFiles(moduleDirectory(fromPath), List.of(name)));
        }

        List<String> segments = new ArrayList<>(Arrays.asList(reference.split("::")));
        String head = segments.remove(0);
        String base;
        switch (head) {
            case "crate" -> base = crateRoot(fromPath);
            case "self" -> base = moduleDirectory(fromPath);
            default -> {
                base = KnownFiles.directoryOf(fromPath);
                if (KnownFiles.fileName(fromPath).equals("mod.rs")) {
                    base = KnownFiles.directoryOf(base);
                }
                while (!segments.isEmpty() && segments.get(0).equals("super")) {
                    segments.remove(0);
                    base = KnownFiles.directoryOf(base);
                }
            }
        }
        // the last segments may be items rather than modules
        for (int length = segments.size(); length >= 1; length--) {
            Optional<String> match = known.firstExisting(moduleFiles(base, segments.subList(0, length)));
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /** Directory holding the child modules of {@code fromPath}. */
    private static String moduleDirectory(String fromPath) {
        String dir = KnownFiles.directoryOf(fromPath);
        String name = KnownFiles.fileName(fromPath);
        if (CRATE_ROOTS.contains(name)) {
            return dir;
        }
        String stem = name.endsWith(".rs") ? name.substring(0, name.length() - 3) : name;
        return dir.isEmpty() ? stem : dir + "/" + stem;
    }

    /** Nearest enclosing {@code src} directory, or the file's own directory. */
    private static String crateRoot(String fromPath) {
        String dir = KnownFiles.directoryOf(fromPath);
        String current = dir;
        while (!current.isEmpty()) {
            if (KnownFiles.fileName(current).equals("src")) {
                return current;
            }
            current = KnownFiles.directoryOf(current);
        }
        return dir;
    }

    private static List<String> moduleFiles(String base, List<String> segments) {
        String modulePath = String.join("/", segments);
        var candidates = new ArrayList<String>();
        KnownFiles.join(base, modulePath + ".rs").ifPresent(candidates::add);
        KnownFiles.join(base, modulePath + "/mod.rs").ifPresent(candidates::add);
        return candidates;
    }
}
