package com.repolens.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for context assembly.
 */
@Service
public class RepoLensMetrics {

    private final MeterRegistry registry;

    public RepoLensMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordContextDuration(long ms, boolean cached) {
        Timer.builder("repolens.context.duration")
                .tag("cached", String.valueOf(cached))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("repolens.cache.lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordCacheEviction() {
        Counter.builder("repolens.cache.evictions")
                .description("Entries dropped by the LRU policy")
                .register(registry)
                .increment();
    }

    /**
     * Records a request whose scan or mapping stopped early.
     */
    public void recordPartialScan() {
        Counter.builder("repolens.scan.partial")
                .description("Context requests answered from an incomplete scan")
                .register(registry)
                .increment();
    }

    /**
     * Records the size of a produced bundle.
     *
     * @param files  number of selected files
     * @param tokens estimated token total
     */
    public void recordBundle(int files, int tokens) {
        DistributionSummary.builder("repolens.bundle.files")
                .register(registry)
                .record(files);
        DistributionSummary.builder("repolens.bundle.tokens")
                .register(registry)
                .record(tokens);
    }
}
