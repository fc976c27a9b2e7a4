package com.repolens.core.engine;

import com.repolens.core.model.ContextBundle;
import com.repolens.core.model.KeywordSet;

/**
 * A bundle together with how it was produced.
 *
 * @param requestId          id used in logs for this request
 * @param repositoryIdentity identity the bundle is cached under
 * @param treeVersion        supplied or fingerprinted tree version; null when fingerprinting ran out of time
 * @param keywords           keywords extracted from the prompt
 * @param bundle             the selected context
 * @param cached             true when no pipeline ran for this request
 * @param durationMs         wall time of the request
 */
public record ContextResult(
    String requestId,
    String repositoryIdentity,
    String treeVersion,
    KeywordSet keywords,
    ContextBundle bundle,
    boolean cached,
    long durationMs
) {}
