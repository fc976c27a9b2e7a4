package com.repolens.core.cache;

import com.repolens.core.model.ContextBundle;

import java.time.Instant;

/**
 * A stored bundle. Entries are never mutated; an access replaces the entry with
 * a copy carrying the new access time.
 */
public record CacheEntry(CacheKey key, ContextBundle bundle, Instant createdAt, Instant lastAccessedAt) {

    CacheEntry touched(Instant now) {
        return new CacheEntry(key, bundle, createdAt, now);
    }
}
