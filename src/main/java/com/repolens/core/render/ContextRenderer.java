package com.repolens.core.render;

import com.repolens.core.model.BundleEntry;
import com.repolens.core.model.ContextBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Formats a bundle as plain text for a model prompt: a summary header, the
 * selected files with their scores, the project's root configuration files,
 * then each file's content in its own block.
 */
public class ContextRenderer {

    private static final Logger log = LoggerFactory.getLogger(ContextRenderer.class);

    static final String TRUNCATION_MARKER = "[truncated]";

    /** Characters shown per configuration file. */
    static final int CONFIG_CHAR_LIMIT = 1500;

    /** Root-level files that describe how a project is built and run, in display order. */
    static final List<String> CONFIG_FILES = List.of(
            "README.md", "package.json", "tsconfig.json", "webpack.config.js",
            "requirements.txt", "pyproject.toml", "setup.py", "Cargo.toml", "go.mod",
            "pom.xml", "build.gradle", "Gemfile", "composer.json", "pubspec.yaml",
            "CMakeLists.txt", "Makefile", "Dockerfile", "docker-compose.yml",
            ".gitignore", "LICENSE"
    );

    public String render(ContextBundle bundle) {
        return render(bundle, null);
    }

    /**
     * Renders {@code bundle}, adding a configuration section read from the root of
     * {@code repositoryRoot}. Configuration files already in the bundle are not repeated.
     */
    public String render(ContextBundle bundle, Path repositoryRoot) {
        var sb = new StringBuilder();
        sb.append("# Repository context\n");
        sb.append("Files: ").append(bundle.fileCount())
                .append(" of ").append(bundle.filesDiscoveredCount()).append(" discovered")
                .append(" | Estimated tokens: ").append(bundle.totalTokensEstimated()).append('\n');

        if (bundle.isEmpty()) {
            sb.append("\nNo relevant files were selected.\n");
            appendConfiguration(sb, bundle, repositoryRoot);
            appendNotes(sb, bundle);
            return sb.toString();
        }

        sb.append("\n## Structure\n");
        for (BundleEntry entry : bundle.entries()) {
            sb.append("- ").append(entry.path())
                    .append(" (").append(entry.language().id())
                    .append(", score ").append(String.format(Locale.ROOT, "%.2f", entry.score()));
            if (entry.truncated()) {
                sb.append(", truncated");
            }
            sb.append(")\n");
        }

        appendConfiguration(sb, bundle, repositoryRoot);

        sb.append("\n## Files\n");
        for (BundleEntry entry : bundle.entries()) {
            sb.append("\n--- ").append(entry.path()).append(" (").append(entry.language().id()).append(") ---\n");
            sb.append(entry.content());
            if (!entry.content().isEmpty() && !entry.content().endsWith("\n")) {
                sb.append('\n');
            }
            if (entry.truncated()) {
                sb.append(TRUNCATION_MARKER).append('\n');
            }
        }
        appendNotes(sb, bundle);
        return sb.toString();
    }

    private static void appendConfiguration(StringBuilder sb, ContextBundle bundle, Path root) {
        if (root == null) {
            return;
        }
        var section = new StringBuilder();
        for (String name : CONFIG_FILES) {
            Path file = root.resolve(name);
            if (bundle.paths().contains(name) || !Files.isRegularFile(file)) {
                continue;
            }
            try {
                String head = readHead(file, CONFIG_CHAR_LIMIT);
                section.append("\n--- ").append(name).append(" ---\n").append(head);
                if (!head.endsWith("\n")) {
                    section.append('\n');
                }
            } catch (IOException e) {
                log.warn("Could not read configuration file {}: {}", name, e.getMessage());
            }
        }
        if (section.length() > 0) {
            sb.append("\n## Configuration Files\n").append(section);
        }
    }

    /** At most {@code limit} characters from the start of {@code file}; malformed bytes are replaced. */
    static String readHead(Path file, int limit) throws IOException {
        try (Reader reader = new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8)) {
            char[] buffer = new char[limit];
            int filled = 0;
            while (filled < limit) {
                int n = reader.read(buffer, filled, limit - filled);
                if (n < 0) {
                    break;
                }
                filled += n;
            }
            return new String(buffer, 0, filled);
        }
    }

    private static void appendNotes(StringBuilder sb, ContextBundle bundle) {
        int omitted = bundle.filesDiscoveredCount() - bundle.fileCount();
        if (omitted > 0) {
            sb.append("\nNote: ").append(omitted).append(" more file(s) in the repository were not included.\n");
        }
        if (bundle.partial()) {
            sb.append("Note: the repository scan was incomplete; some files may be missing.\n");
        }
    }
}
