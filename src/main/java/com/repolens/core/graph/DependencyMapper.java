package com.repolens.core.graph;

import com.repolens.core.model.Deadline;
import com.repolens.core.model.DependencyGraph;
import com.repolens.core.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Builds the file-to-file import graph from scanned file contents.
 * <p>
 * Each file is handed to the {@link ImportSyntax} registered for its language.
 * References that do not resolve to a scanned path are dropped without a trace,
 * so the graph only ever contains scanned files. Mapping honours the request
 * deadline between files.
 */
public class DependencyMapper {

    private static final Logger log = LoggerFactory.getLogger(DependencyMapper.class);

    private final ImportSyntaxRegistry registry;

    public DependencyMapper(ImportSyntaxRegistry registry) {
        this.registry = registry;
    }

    public DependencyGraph buildGraph(List<FileRecord> files) {
        return buildGraph(files, Deadline.none()).graph();
    }

    public MappingResult buildGraph(List<FileRecord> files, Deadline deadline) {
        var known = new KnownFiles(files);
        var builder = DependencyGraph.builder();
        boolean partial = false;
        int mapped = 0;

        for (FileRecord file : files) {
            Optional<ImportSyntax> syntax = registry.forLanguage(file.language());
            Optional<String> content = file.content();
            if (syntax.isEmpty() || content.isEmpty()) {
                continue;
            }
            if (deadline.isExpired()) {
                log.warn("Mapping deadline reached after {} files", mapped);
                partial = true;
                break;
            }
            for (String reference : syntax.get().references(content.get())) {
                syntax.get().resolve(file.path(), reference, known)
                        .ifPresent(target -> builder.addEdge(file.path(), target));
            }
            mapped++;
        }

        var graph = builder.build();
        log.debug("Mapped {} files, {} edges", mapped, graph.edgeCount());
        return new MappingResult(graph, partial);
    }
}
