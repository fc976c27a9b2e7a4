package com.repolens.core.graph;

import com.repolens.core.model.FileRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lookup index over the scanned paths, used to resolve import references.
 * Every answer is a path from the scan, so resolution can never invent a node.
 */
public final class KnownFiles {

    private static final Pattern GO_MODULE = Pattern.compile("^\\s*module\\s+\"?([^\\s\"]+)\"?", Pattern.MULTILINE);

    private final Set<String> paths = new TreeSet<>();
    private final Map<String, List<String>> byFileName = new HashMap<>();
    private final Map<String, List<String>> byDirectory = new TreeMap<>();
    private final Map<String, String> goModules = new TreeMap<>();

    public KnownFiles(Collection<FileRecord> files) {
        for (FileRecord file : files) {
            paths.add(file.path());
            if (file.fileName().equals("go.mod")) {
                file.content().map(GO_MODULE::matcher).filter(Matcher::find)
                        .ifPresent(m -> goModules.put(m.group(1), directoryOf(file.path())));
            }
        }
        for (String path : paths) {
            byFileName.computeIfAbsent(fileName(path), k -> new ArrayList<>()).add(path);
            byDirectory.computeIfAbsent(directoryOf(path), k -> new ArrayList<>()).add(path);
        }
    }

    public boolean contains(String path) {
        return paths.contains(path);
    }

    /** The first candidate that is a known path. */
    public Optional<String> firstExisting(List<String> candidates) {
        for (String candidate : candidates) {
            if (candidate != null && paths.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Lexically first known path equal to {@code suffix} or ending in
     * {@code "/" + suffix}. Used for source-root layouts such as
     * {@code src/main/java/com/acme/Foo.java}.
     */
    public Optional<String> findBySuffix(String suffix) {
        if (suffix == null || suffix.isEmpty()) {
            return Optional.empty();
        }
        List<String> sameName = byFileName.get(fileName(suffix));
        if (sameName == null) {
            return Optional.empty();
        }
        for (String path : sameName) {
            if (path.equals(suffix) || path.endsWith("/" + suffix)) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    /** Files directly inside {@code directory} ("" for the root), in path order. */
    public List<String> filesIn(String directory) {
        return byDirectory.getOrDefault(directory, List.of());
    }

    /** Known directories equal to {@code suffix} or ending in {@code "/" + suffix}, in path order. */
    public List<String> directoriesEndingWith(String suffix) {
        var matches = new ArrayList<String>();
        for (String dir : byDirectory.keySet()) {
            if (dir.equals(suffix) || dir.endsWith("/" + suffix)) {
                matches.add(dir);
            }
        }
        return matches;
    }

    /**
     * Directory named by a Go import path that lies inside a module declared by a
     * scanned {@code go.mod}; the longest matching module path wins.
     */
    public Optional<String> goPackageDirectory(String importPath) {
        String bestModule = null;
        for (String module : goModules.keySet()) {
            boolean inside = importPath.equals(module) || importPath.startsWith(module + "/");
            if (inside && (bestModule == null || module.length() > bestModule.length())) {
                bestModule = module;
            }
        }
        if (bestModule == null) {
            return Optional.empty();
        }
        String moduleDir = goModules.get(bestModule);
        String rest = importPath.substring(bestModule.length());
        if (rest.startsWith("/")) {
            rest = rest.substring(1);
        }
        if (rest.isEmpty()) {
            return Optional.of(moduleDir);
        }
        return Optional.of(moduleDir.isEmpty() ? rest : moduleDir + "/" + rest);
    }

    public static String directoryOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    public static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /**
     * Resolves {@code relative} against {@code directory}, folding {@code .} and
     * {@code ..} segments. Empty when the result would leave the tree root.
     */
    public static Optional<String> join(String directory, String relative) {
        var segments = new ArrayList<String>();
        if (!directory.isEmpty() && !relative.startsWith("/")) {
            for (String s : directory.split("/")) {
                segments.add(s);
            }
        }
        for (String s : relative.split("/")) {
            if (s.isEmpty() || s.equals(".")) {
                continue;
            }
            if (s.equals("..")) {
                if (segments.isEmpty()) {
                    return Optional.empty();
                }
                segments.remove(segments.size() - 1);
            } else {
                segments.add(s);
            }
        }
        return segments.isEmpty() ? Optional.empty() : Optional.of(String.join("/", segments));
    }
}
