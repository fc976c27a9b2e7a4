package com.repolens.core.graph;

import com.repolens.core.model.DependencyGraph;

/**
 * @param graph   edges found before mapping finished or stopped
 * @param partial true when the deadline stopped mapping early
 */
public record MappingResult(DependencyGraph graph, boolean partial) {}
