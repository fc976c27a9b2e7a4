package com.repolens.core.render;

import com.repolens.core.model.BundleEntry;
import com.repolens.core.model.ContextBundle;
import com.repolens.core.model.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextRendererTest {

    private final ContextRenderer renderer = new ContextRenderer();

    private static BundleEntry entry(String path, String content, boolean truncated) {
        return new BundleEntry(path, Language.fromFileName(path), content, 4.25, 10, truncated, List.of("name:login"));
    }

    @Test
    @DisplayName("renders header, structure and one block per file in bundle order")
    void rendersBundle() {
        var bundle = new ContextBundle(List.of(
                entry("auth/login.py", "def login():\n    pass\n", false),
                entry("auth/tokens.py", "TTL = 3600", false)), 20, 3, 5, false);

        String text = renderer.render(bundle);

        assertTrue(text.startsWith("# Repository context\n"));
        assertTrue(text.contains("Files: 2 of 5 discovered | Estimated tokens: 20"));
        assertTrue(text.contains("- auth/login.py (python, score 4.25)"));
        assertTrue(text.contains("--- auth/tokens.py (python) ---\nTTL = 3600\n"));
        assertTrue(text.indexOf("--- auth/login.py") < text.indexOf("--- auth/tokens.py"));
        assertTrue(text.contains("Note: 3 more file(s)"));
        assertFalse(text.contains("incomplete"));
    }

    @Test
    @DisplayName("marks truncated files")
    void truncatedMarker() {
        var bundle = new ContextBundle(List.of(entry("big.py", "line\n", true)), 10, 1, 1, false);

        String text = renderer.render(bundle);

        assertTrue(text.contains("(python, score 4.25, truncated)"));
        assertTrue(text.contains("line\n" + ContextRenderer.TRUNCATION_MARKER + "\n"));
    }

    @Test
    @DisplayName("empty bundles say so and still report an incomplete scan")
    void emptyPartial() {
        var bundle = new ContextBundle(List.of(), 0, 0, 4, true);

        String text = renderer.render(bundle);

        assertTrue(text.contains("No relevant files were selected."));
        assertTrue(text.contains("the repository scan was incomplete"));
        assertFalse(text.contains("## Files"));
    }

    @Nested
    @DisplayName("configuration files")
    class Configuration {

        @TempDir
        Path root;

        @Test
        @DisplayName("root configuration files are shown between structure and file contents")
        void rendersSection() throws Exception {
            Files.writeString(root.resolve("requirements.txt"), "flask==3.0.0\npyjwt==2.8.0\n");
            Files.writeString(root.resolve("notes.txt"), "not a configuration file\n");
            var bundle = new ContextBundle(List.of(entry("auth/login.py", "def login():\n    pass\n", false)),
                    10, 1, 3, false);

            String text = renderer.render(bundle, root);

            assertTrue(text.contains("## Configuration Files\n\n--- requirements.txt ---\nflask==3.0.0\npyjwt==2.8.0\n"));
            assertFalse(text.contains("notes.txt"));
            assertTrue(text.indexOf("## Structure") < text.indexOf("## Configuration Files"));
            assertTrue(text.indexOf("## Configuration Files") < text.indexOf("## Files"));
        }

        @Test
        @DisplayName("long configuration files are cut at the character limit")
        void capsLength() throws Exception {
            Files.writeString(root.resolve("package.json"), "x".repeat(ContextRenderer.CONFIG_CHAR_LIMIT + 500));
            var bundle = new ContextBundle(List.of(), 0, 0, 1, false);

            String text = renderer.render(bundle, root);

            assertTrue(text.contains("x".repeat(ContextRenderer.CONFIG_CHAR_LIMIT) + "\n"));
            assertFalse(text.contains("x".repeat(ContextRenderer.CONFIG_CHAR_LIMIT + 1)));
        }

        @Test
        @DisplayName("a configuration file already in the bundle is not repeated")
        void skipsSelected() throws Exception {
            Files.writeString(root.resolve("README.md"), "# Shop\n");
            var bundle = new ContextBundle(List.of(entry("README.md", "# Shop\n", false)), 10, 1, 1, false);

            String text = renderer.render(bundle, root);

            assertFalse(text.contains("## Configuration Files"));
            assertEquals(1, text.split("# Shop", -1).length - 1);
        }

        @Test
        @DisplayName("without a root no configuration section is rendered")
        void noRoot() throws Exception {
            Files.writeString(root.resolve("go.mod"), "module example.com/shop\n");
            var bundle = new ContextBundle(List.of(entry("main.go", "package main\n", false)), 10, 1, 1, false);

            assertFalse(renderer.render(bundle).contains("## Configuration Files"));
            assertTrue(renderer.render(bundle, root).contains("--- go.mod ---\nmodule example.com/shop\n"));
        }
    }
}
