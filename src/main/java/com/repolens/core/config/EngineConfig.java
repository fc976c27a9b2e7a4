package com.repolens.core.config;

import com.repolens.core.cache.ContextCache;
import com.repolens.core.engine.ContextEngine;
import com.repolens.core.graph.DependencyMapper;
import com.repolens.core.graph.ImportSyntaxRegistry;
import com.repolens.core.keywords.KeywordExtractor;
import com.repolens.core.metrics.RepoLensMetrics;
import com.repolens.core.render.ContextRenderer;
import com.repolens.core.scanner.TreeScanner;
import com.repolens.core.scoring.RelevanceScorer;
import com.repolens.core.selection.BudgetedSelector;
import com.repolens.core.selection.TokenEstimator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns {@link RepoLensProperties} into the engine's collaborators. Core classes
 * take plain constructor arguments and never read configuration themselves.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Bounded pool for file reads. */
    @Bean(destroyMethod = "shutdownNow")
    public ThreadPoolExecutor scanPool(RepoLensProperties properties) {
        int size = Math.max(1, properties.getScan().getWorkerPoolSize());
        var counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            var thread = new Thread(runnable, "repolens-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), threads);
    }

    @Bean
    public TreeScanner treeScanner(ThreadPoolExecutor scanPool) {
        return new TreeScanner(scanPool);
    }

    @Bean
    public KeywordExtractor keywordExtractor() {
        return new KeywordExtractor();
    }

    @Bean
    public DependencyMapper dependencyMapper() {
        return new DependencyMapper(ImportSyntaxRegistry.defaults());
    }

    @Bean
    public RelevanceScorer relevanceScorer(RepoLensProperties properties) {
        return new RelevanceScorer(properties.getScoring().toWeights());
    }

    @Bean
    public BudgetedSelector budgetedSelector() {
        return new BudgetedSelector(new TokenEstimator());
    }

    @Bean
    public ContextCache contextCache(RepoLensProperties properties, Clock clock,
                                     @Autowired(required = false) RepoLensMetrics metrics) {
        var cache = properties.getCache();
        return new ContextCache(cache.getCapacity(), Duration.ofSeconds(cache.getTtlSeconds()), clock, metrics);
    }

    @Bean
    public ContextRenderer contextRenderer() {
        return new ContextRenderer();
    }

    @Bean
    public ContextEngine contextEngine(TreeScanner scanner, KeywordExtractor extractor, DependencyMapper mapper,
                                       RelevanceScorer scorer, BudgetedSelector selector, ContextCache cache,
                                       Clock clock, @Autowired(required = false) RepoLensMetrics metrics) {
        return new ContextEngine(scanner, extractor, mapper, scorer, selector, cache, clock, metrics);
    }
}
