package com.repolens.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/context.
 *
 * @param prompt          natural-language task prompt
 * @param projectPath     absolute path to the working tree
 * @param repositoryId    stable repository name; nullable, defaults to the tree's real path
 * @param treeVersion     commit hash or other tree state id; nullable, fingerprinted when absent
 * @param maxTokens       nullable, falls back to configuration
 * @param maxFiles        nullable, falls back to configuration
 * @param maxCharsPerFile nullable, falls back to configuration
 * @param maxDepth        nullable, falls back to configuration
 * @param timeoutSeconds  nullable, falls back to configuration
 * @param exclude         extra exclusion globs
 * @param format          {@code json} (default) or {@code text}
 */
public record ContextRequestBody(
    String prompt,
    @JsonProperty("project_path") String projectPath,
    @JsonProperty("repository_id") String repositoryId,
    @JsonProperty("tree_version") String treeVersion,
    @JsonProperty("max_tokens") Integer maxTokens,
    @JsonProperty("max_files") Integer maxFiles,
    @JsonProperty("max_chars_per_file") Integer maxCharsPerFile,
    @JsonProperty("max_depth") Integer maxDepth,
    @JsonProperty("timeout_seconds") Integer timeoutSeconds,
    List<String> exclude,
    String format
) {}
