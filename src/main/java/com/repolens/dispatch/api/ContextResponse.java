package com.repolens.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.repolens.core.engine.ContextResult;
import com.repolens.core.model.BundleEntry;
import com.repolens.core.model.ContextBundle;

import java.util.List;

/**
 * JSON response for POST /api/v1/context, also printed by {@code repolens context --format json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextResponse(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("repository_id") String repositoryId,
    @JsonProperty("tree_version") String treeVersion,
    List<String> keywords,
    List<FileResponse> files,
    @JsonProperty("total_tokens") int totalTokens,
    @JsonProperty("files_considered") int filesConsidered,
    @JsonProperty("files_discovered") int filesDiscovered,
    boolean partial,
    boolean cached,
    @JsonProperty("duration_ms") long durationMs,
    String rendered
) {

    /**
     * Nested file representation in the context response.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record FileResponse(
        String path,
        String language,
        double score,
        @JsonProperty("estimated_tokens") int estimatedTokens,
        boolean truncated,
        List<String> reasons,
        String content
    ) {}

    public static ContextResponse from(ContextResult result) {
        ContextBundle bundle = result.bundle();
        var files = bundle.entries().stream().map(ContextResponse::toFile).toList();
        return new ContextResponse(result.requestId(), result.repositoryIdentity(), result.treeVersion(),
                result.keywords().terms(), files, bundle.totalTokensEstimated(), bundle.filesConsideredCount(),
                bundle.filesDiscoveredCount(), bundle.partial(), result.cached(), result.durationMs(), null);
    }

    /** Text form: file contents only appear inside {@code rendered}. */
    public static ContextResponse rendered(ContextResult result, String rendered) {
        ContextBundle bundle = result.bundle();
        var files = bundle.entries().stream()
                .map(e -> new FileResponse(e.path(), e.language().id(), e.score(), e.estimatedTokens(),
                        e.truncated(), e.matchReasons(), null))
                .toList();
        return new ContextResponse(result.requestId(), result.repositoryIdentity(), result.treeVersion(),
                result.keywords().terms(), files, bundle.totalTokensEstimated(), bundle.filesConsideredCount(),
                bundle.filesDiscoveredCount(), bundle.partial(), result.cached(), result.durationMs(), rendered);
    }

    private static FileResponse toFile(BundleEntry entry) {
        return new FileResponse(entry.path(), entry.language().id(), entry.score(), entry.estimatedTokens(),
                entry.truncated(), entry.matchReasons(), entry.content());
    }
}
