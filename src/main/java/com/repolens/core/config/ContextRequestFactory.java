package com.repolens.core.config;

import com.repolens.core.model.ContextBudget;
import com.repolens.core.model.ContextRequest;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link ContextRequest}s for the CLI and REST layers, filling every limit
 * the caller left out from {@link RepoLensProperties}. Caller exclusion globs are
 * added to the configured ones.
 */
@Component
public class ContextRequestFactory {

    private final RepoLensProperties properties;

    public ContextRequestFactory(RepoLensProperties properties) {
        this.properties = properties;
    }

    public Overrides forPrompt(Path root, String prompt) {
        return new Overrides(root, prompt);
    }

    public final class Overrides {
        private final Path root;
        private final String prompt;
        private String repositoryId;
        private String treeVersion;
        private Integer maxTokens;
        private Integer maxFiles;
        private Integer maxCharsPerFile;
        private Integer maxDepth;
        private Integer timeoutSeconds;
        private List<String> excludes = List.of();

        private Overrides(Path root, String prompt) {
            this.root = root;
            this.prompt = prompt;
        }

        public Overrides repositoryId(String value) { this.repositoryId = value; return this; }
        public Overrides treeVersion(String value) { this.treeVersion = value; return this; }
        public Overrides maxTokens(Integer value) { this.maxTokens = value; return this; }
        public Overrides maxFiles(Integer value) { this.maxFiles = value; return this; }
        public Overrides maxCharsPerFile(Integer value) { this.maxCharsPerFile = value; return this; }
        public Overrides maxDepth(Integer value) { this.maxDepth = value; return this; }
        public Overrides timeoutSeconds(Integer value) { this.timeoutSeconds = value; return this; }
        public Overrides excludes(List<String> value) { this.excludes = value == null ? List.of() : value; return this; }

        /**
         * @throws IllegalArgumentException if a limit is out of range
         */
        public ContextRequest build() {
            ContextBudget defaults = properties.defaultBudget();
            var budget = new ContextBudget(
                    maxTokens != null ? maxTokens : defaults.maxTokens(),
                    maxFiles != null ? maxFiles : defaults.maxFiles(),
                    maxCharsPerFile != null ? maxCharsPerFile : defaults.maxCharsPerFile(),
                    maxDepth != null ? maxDepth : defaults.maxDepth());
            if (timeoutSeconds != null && timeoutSeconds < 0) {
                throw new IllegalArgumentException("timeout must be >= 0");
            }
            Duration timeout = timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : properties.defaultTimeout();
            var patterns = new ArrayList<String>(properties.getScan().getExcludePatterns());
            patterns.addAll(excludes);
            return new ContextRequest(root, repositoryId, treeVersion, prompt, budget,
                    properties.getScan().getMaxFileSizeBytes(), patterns, timeout);
        }
    }
}
