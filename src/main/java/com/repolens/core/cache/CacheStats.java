package com.repolens.core.cache;

public record CacheStats(
    int size,
    int capacity,
    long ttlSeconds,
    long hits,
    long misses,
    long evictions,
    long invalidations,
    int inFlight
) {}
