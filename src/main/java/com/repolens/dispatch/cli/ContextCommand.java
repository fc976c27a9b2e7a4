package com.repolens.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repolens.core.config.ContextRequestFactory;
import com.repolens.core.engine.ContextEngine;
import com.repolens.core.engine.ContextResult;
import com.repolens.core.model.BundleEntry;
import com.repolens.core.model.ContextBundle;
import com.repolens.core.model.ContextRequest;
import com.repolens.core.render.ContextRenderer;
import com.repolens.core.scanner.ScanException;
import com.repolens.dispatch.api.ContextResponse;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: repolens context "&lt;prompt&gt;"
 * <p>
 * Assembles the context bundle for a prompt against a local working tree and
 * prints it as a ranked summary, the rendered context text, or JSON.
 */
@Command(name = "context", mixinStandardHelpOptions = true,
        description = "Select the repository files relevant to a prompt")
@Component
public class ContextCommand implements Callable<Integer> {

    enum Format { summary, text, json }

    @Parameters(index = "0", description = "Natural language task prompt")
    private String prompt;

    @Option(names = {"--path", "-p"}, description = "Repository root (default: current directory)",
            defaultValue = ".")
    private Path path;

    @Option(names = "--max-tokens", description = "Estimated token budget")
    private Integer maxTokens;

    @Option(names = "--max-files", description = "Maximum number of files")
    private Integer maxFiles;

    @Option(names = "--max-chars", description = "Characters kept per file")
    private Integer maxChars;

    @Option(names = "--max-depth", description = "Directory depth to scan")
    private Integer maxDepth;

    @Option(names = "--timeout", description = "Scan timeout in seconds, 0 for none")
    private Integer timeoutSeconds;

    @Option(names = {"--exclude", "-x"}, description = "Extra exclusion glob, repeatable")
    private List<String> excludes = new ArrayList<>();

    @Option(names = "--tree-version", description = "Commit hash or other tree version; fingerprinted when absent")
    private String treeVersion;

    @Option(names = {"--format", "-f"}, description = "Output: ${COMPLETION-CANDIDATES}",
            defaultValue = "summary")
    private Format format;

    @Option(names = "--explain", description = "Show why each file was selected")
    private boolean explain;

    private final ContextEngine contextEngine;
    private final ContextRequestFactory requestFactory;
    private final ContextRenderer renderer;
    private final ObjectMapper objectMapper;

    public ContextCommand(ContextEngine contextEngine, ContextRequestFactory requestFactory,
                          ContextRenderer renderer, ObjectMapper objectMapper) {
        this.contextEngine = contextEngine;
        this.requestFactory = requestFactory;
        this.renderer = renderer;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ContextResult result;
        try {
            ContextRequest request = requestFactory.forPrompt(path, prompt)
                    .treeVersion(treeVersion)
                    .maxTokens(maxTokens)
                    .maxFiles(maxFiles)
                    .maxCharsPerFile(maxChars)
                    .maxDepth(maxDepth)
                    .timeoutSeconds(timeoutSeconds)
                    .excludes(excludes)
                    .build();
            result = contextEngine.assemble(request);
        } catch (ScanException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        switch (format) {
            case text -> System.out.print(renderer.render(result.bundle(), path));
            case json -> {
                try {
                    System.out.println(objectMapper.writerWithDefaultPrettyPrinter()
                            .writeValueAsString(ContextResponse.from(result)));
                } catch (JsonProcessingException e) {
                    ConsoleOutput.error("Could not serialize bundle: " + e.getOriginalMessage());
                    return 1;
                }
            }
            default -> printSummary(result);
        }
        return 0;
    }

    private void printSummary(ContextResult result) {
        ContextBundle bundle = result.bundle();
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Keywords: " + (result.keywords().isEmpty()
                ? "(none)" : String.join(", ", result.keywords().terms())));
        ConsoleOutput.info(String.format("Tree: %s @ %s", result.repositoryIdentity(),
                result.treeVersion() == null ? "unversioned" : result.treeVersion()));
        System.out.println();

        if (bundle.isEmpty()) {
            ConsoleOutput.warn("No relevant files were selected.");
        }
        int rank = 1;
        for (BundleEntry entry : bundle.entries()) {
            ConsoleOutput.fileEntry(rank++, entry);
            if (explain) {
                entry.matchReasons().forEach(ConsoleOutput::reason);
            }
        }

        System.out.println("──────────────────────────────────");
        ConsoleOutput.info(String.format("%d files, %d tokens | %d considered of %d discovered | %s%s",
                bundle.fileCount(), bundle.totalTokensEstimated(), bundle.filesConsideredCount(),
                bundle.filesDiscoveredCount(), ConsoleOutput.formatDuration(result.durationMs()),
                result.cached() ? " (cached)" : ""));
        if (bundle.partial()) {
            ConsoleOutput.warn("Scan incomplete: some files may be missing from the bundle.");
        }
    }
}
