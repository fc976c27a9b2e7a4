package com.repolens.core.scanner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExclusionRulesTest {

    private final ExclusionRules defaults = ExclusionRules.defaults();

    // ── Directories ──────────────────────────────────────────────────

    @Test
    @DisplayName("skips dependency, build and VCS directories")
    void skipsIgnoredDirectories() {
        assertTrue(defaults.excludesDirectory("node_modules", "node_modules"));
        assertTrue(defaults.excludesDirectory("web/node_modules", "node_modules"));
        assertTrue(defaults.excludesDirectory(".git", ".git"));
        assertTrue(defaults.excludesDirectory("target", "target"));
        assertTrue(defaults.excludesDirectory("pkg/__pycache__", "__pycache__"));
        assertFalse(defaults.excludesDirectory("src", "src"));
    }

    @Test
    @DisplayName("skips hidden directories")
    void skipsHiddenDirectories() {
        assertTrue(defaults.excludesDirectory(".github", ".github"));
        assertTrue(defaults.excludesDirectory("app/.cache", ".cache"));
    }

    // ── Files ────────────────────────────────────────────────────────

    @Test
    @DisplayName("keeps .gitignore and .env.example but skips other dotfiles")
    void dotfiles() {
        assertFalse(defaults.excludesFile(".gitignore", ".gitignore"));
        assertFalse(defaults.excludesFile(".env.example", ".env.example"));
        assertTrue(defaults.excludesFile(".env", ".env"));
        assertTrue(defaults.excludesFile(".DS_Store", ".DS_Store"));
    }

    @Test
    @DisplayName("skips compiled and generated artefacts at any depth")
    void skipsArtefacts() {
        for (String path : List.of("a.pyc", "lib/b.class", "deep/dir/c.so", "app.log", "dist.min.js", "x/y.map")) {
            String name = path.substring(path.lastIndexOf('/') + 1);
            assertTrue(defaults.excludesFile(path, name), path);
        }
        assertFalse(defaults.excludesFile("src/main.js", "main.js"));
        assertFalse(defaults.excludesFile("Thumbs.txt", "Thumbs.txt"));
    }

    // ── Caller patterns ──────────────────────────────────────────────

    @Test
    @DisplayName("caller globs match bare names and relative paths")
    void callerGlobs() {
        var rules = ExclusionRules.withPatterns(List.of("*.sql", "docs/**"));
        assertTrue(rules.excludesFile("db/migrations/001.sql", "001.sql"));
        assertTrue(rules.excludesFile("docs/guide/intro.md", "intro.md"));
        assertFalse(rules.excludesFile("README.md", "README.md"));
    }

    @Test
    @DisplayName("caller globs can exclude directories")
    void callerGlobExcludesDirectory() {
        var rules = ExclusionRules.withPatterns(List.of("fixtures"));
        assertTrue(rules.excludesDirectory("test/fixtures", "fixtures"));
    }

    @Test
    @DisplayName("blank and null patterns are ignored")
    void blankPatterns() {
        var rules = ExclusionRules.withPatterns(Arrays.asList(" ", null, " *.csv "));
        assertEquals(List.of("*.csv"), rules.callerPatterns());
        assertTrue(ExclusionRules.withPatterns(null).callerPatterns().isEmpty());
    }
}
