package com.repolens.core.scanner;

import java.nio.file.FileSystems;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides which directories and files a scan leaves out.
 * <p>
 * The default rules skip version-control metadata, dependency and virtualenv
 * directories, build output, IDE folders, hidden entries (apart from a few
 * useful dotfiles) and compiled or generated artefacts. Caller globs are matched
 * against both the root-relative path and the bare file name, so {@code *.sql}
 * and {@code docs/**} both work.
 */
public final class ExclusionRules {

    static final Set<String> IGNORED_DIRECTORIES = Set.of(
            ".git", ".svn", ".hg", "node_modules", "__pycache__", "target", "build", "dist",
            "out", ".next", ".nuxt", "coverage", "htmlcov", ".pytest_cache", ".mypy_cache",
            "vendor", "venv", "env", ".venv", ".idea", ".vscode", ".gradle", ".mvn"
    );

    static final Set<String> IGNORED_FILES = Set.of(".DS_Store", "Thumbs.db");

    static final Set<String> ALLOWED_DOTFILES = Set.of(".gitignore", ".env.example");

    static final List<String> ARTEFACT_GLOBS = List.of(
            "*.pyc", "*.pyo", "*.class", "*.jar", "*.war", "*.o", "*.a", "*.so", "*.dylib",
            "*.dll", "*.exe", "*.bin", "*.log", "*.lock", "*.tmp", "*.cache", "*.swp", "*.min.js", "*.map"
    );

    private final List<String> globs;
    private final List<PathMatcher> artefactMatchers;
    private final List<PathMatcher> callerMatchers;

    private ExclusionRules(List<String> callerGlobs) {
        this.globs = List.copyOf(callerGlobs);
        this.artefactMatchers = compile(ARTEFACT_GLOBS);
        this.callerMatchers = compile(callerGlobs);
    }

    public static ExclusionRules defaults() {
        return new ExclusionRules(List.of());
    }

    /** Default rules plus the given caller globs. Blank patterns are ignored. */
    public static ExclusionRules withPatterns(List<String> callerGlobs) {
        var cleaned = new ArrayList<String>();
        if (callerGlobs != null) {
            for (String glob : callerGlobs) {
                if (glob != null && !glob.isBlank()) {
                    cleaned.add(glob.trim());
                }
            }
        }
        return new ExclusionRules(cleaned);
    }

    public List<String> callerPatterns() {
        return globs;
    }

    public boolean excludesDirectory(String relativePath, String name) {
        if (IGNORED_DIRECTORIES.contains(name) || name.startsWith(".")) {
            return true;
        }
        return matchesAny(callerMatchers, relativePath, name);
    }

    public boolean excludesFile(String relativePath, String name) {
        if (IGNORED_FILES.contains(name)) {
            return true;
        }
        if (name.startsWith(".") && !ALLOWED_DOTFILES.contains(name)) {
            return true;
        }
        return matchesAny(artefactMatchers, relativePath, name)
                || matchesAny(callerMatchers, relativePath, name);
    }

    private static boolean matchesAny(List<PathMatcher> matchers, String relativePath, String name) {
        if (matchers.isEmpty()) {
            return false;
        }
        var rel = Paths.get(relativePath);
        var bare = Paths.get(name);
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(rel) || matcher.matches(bare)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> compile(List<String> globs) {
        var matchers = new ArrayList<PathMatcher>(globs.size());
        for (String glob : globs) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        }
        return List.copyOf(matchers);
    }
}
