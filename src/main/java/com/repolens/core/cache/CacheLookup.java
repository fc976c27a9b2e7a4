package com.repolens.core.cache;

import com.repolens.core.model.ContextBundle;

/**
 * @param bundle the bundle returned to the caller
 * @param cached true when it came from the cache or from another request's computation
 */
public record CacheLookup(ContextBundle bundle, boolean cached) {}
