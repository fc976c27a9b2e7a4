package com.repolens.core.cache;

import com.repolens.core.metrics.RepoLensMetrics;
import com.repolens.core.model.ContextBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded LRU cache of context bundles, shared by all requests.
 * <p>
 * Concurrency: one {@link ReentrantLock} guards the entry map, the in-flight
 * table and the counters; no computation runs while it is held. Concurrent
 * {@link #getOrCompute} calls for the same key share a single computation: the
 * first caller computes, later callers wait on its future. If that computation
 * fails, a waiter retries and becomes the computing caller.
 * <p>
 * Entries expire after the configured lifetime. Looking up a key lazily drops the
 * entries of the same repository, prompt and budget that carry another tree
 * version. Partial bundles are returned but never stored.
 */
public class ContextCache {

    private static final Logger log = LoggerFactory.getLogger(ContextCache.class);

    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final RepoLensMetrics metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<CacheKey, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<CacheKey, CompletableFuture<ContextBundle>> inFlight = new HashMap<>();

    private long hits;
    private long misses;
    private long evictions;
    private long invalidations;

    /**
     * @param capacity entry ceiling; 0 disables storing
     * @param ttl      entry lifetime; zero or negative means entries do not expire
     * @param clock    time source for lifetimes
     * @param metrics  may be {@code null}
     */
    public ContextCache(int capacity, Duration ttl, Clock clock, RepoLensMetrics metrics) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        this.capacity = capacity;
        this.ttl = ttl == null ? Duration.ZERO : ttl;
        this.clock = clock;
        this.metrics = metrics;
    }

    public Optional<ContextBundle> get(CacheKey key) {
        lock.lock();
        try {
            CacheEntry entry = lookupLocked(key);
            return entry == null ? Optional.empty() : Optional.of(entry.bundle());
        } finally {
            lock.unlock();
        }
    }

    /** Stores {@code bundle} unless it is partial. */
    public void put(CacheKey key, ContextBundle bundle) {
        if (bundle.partial() || capacity == 0) {
            return;
        }
        lock.lock();
        try {
            putLocked(key, bundle);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached bundle for {@code key}, or runs {@code computation} once
     * for all concurrent callers of the same key and caches a complete result.
     */
    public <E extends Exception> CacheLookup getOrCompute(CacheKey key, BundleComputation<E> computation) throws E {
        while (true) {
            CompletableFuture<ContextBundle> pending;
            CompletableFuture<ContextBundle> mine = null;
            lock.lock();
            try {
                CacheEntry entry = lookupLocked(key);
                if (entry != null) {
                    return new CacheLookup(entry.bundle(), true);
                }
                pending = inFlight.get(key);
                if (pending == null) {
                    mine = new CompletableFuture<>();
                    inFlight.put(key, mine);
                }
            } finally {
                lock.unlock();
            }

            if (mine != null) {
                return new CacheLookup(computeAndStore(key, computation, mine), false);
            }
            try {
                return new CacheLookup(pending.join(), true);
            } catch (CompletionException | CancellationException e) {
                log.debug("Shared computation for {} failed, retrying", key.repositoryIdentity());
            }
        }
    }

    private <E extends Exception> ContextBundle computeAndStore(CacheKey key, BundleComputation<E> computation,
                                                                CompletableFuture<ContextBundle> future) throws E {
        ContextBundle bundle;
        try {
            bundle = computation.compute();
        } catch (Exception | Error e) {
            lock.lock();
            try {
                inFlight.remove(key);
            } finally {
                lock.unlock();
            }
            future.completeExceptionally(e);
            throw e;
        }
        lock.lock();
        try {
            if (!bundle.partial() && capacity > 0) {
                putLocked(key, bundle);
            }
            inFlight.remove(key);
        } finally {
            lock.unlock();
        }
        future.complete(bundle);
        return bundle;
    }

    /** Removes every entry; returns how many were removed. */
    public int clear() {
        lock.lock();
        try {
            int removed = entries.size();
            entries.clear();
            log.info("Context cache cleared ({} entries)", removed);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(entries.size(), capacity, ttl.toSeconds(),
                    hits, misses, evictions, invalidations, inFlight.size());
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    private CacheEntry lookupLocked(CacheKey key) {
        invalidateOtherVersionsLocked(key);
        Instant now = clock.instant();
        CacheEntry entry = entries.get(key);
        if (entry != null && isExpired(entry, now)) {
            entries.remove(key);
            invalidations++;
            entry = null;
        }
        if (entry == null) {
            misses++;
            record(false);
            return null;
        }
        CacheEntry touched = entry.touched(now);
        entries.put(key, touched);
        hits++;
        record(true);
        return touched;
    }

    private void putLocked(CacheKey key, ContextBundle bundle) {
        Instant now = clock.instant();
        entries.put(key, new CacheEntry(key, bundle, now, now));
        Iterator<CacheKey> eldest = entries.keySet().iterator();
        while (entries.size() > capacity && eldest.hasNext()) {
            CacheKey victim = eldest.next();
            eldest.remove();
            evictions++;
            if (metrics != null) {
                metrics.recordCacheEviction();
            }
            log.debug("Evicted cache entry for {} @ {}", victim.repositoryIdentity(), victim.treeVersion());
        }
    }

    private void invalidateOtherVersionsLocked(CacheKey key) {
        Iterator<CacheKey> it = entries.keySet().iterator();
        while (it.hasNext()) {
            CacheKey existing = it.next();
            if (existing.sameSlot(key) && !existing.treeVersion().equals(key.treeVersion())) {
                it.remove();
                invalidations++;
                log.debug("Invalidated cache entry for {} @ {}", existing.repositoryIdentity(), existing.treeVersion());
            }
        }
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return !ttl.isZero() && !ttl.isNegative() && !now.isBefore(entry.createdAt().plus(ttl));
    }

    private void record(boolean hit) {
        if (metrics != null) {
            metrics.recordCacheLookup(hit);
        }
    }
}
