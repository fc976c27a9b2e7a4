package com.repolens.core.engine;

import com.repolens.core.cache.CacheKey;
import com.repolens.core.cache.CacheLookup;
import com.repolens.core.cache.CacheStats;
import com.repolens.core.cache.ContextCache;
import com.repolens.core.graph.DependencyMapper;
import com.repolens.core.graph.MappingResult;
import com.repolens.core.keywords.KeywordExtractor;
import com.repolens.core.logging.MdcContext;
import com.repolens.core.metrics.RepoLensMetrics;
import com.repolens.core.model.ContextBundle;
import com.repolens.core.model.ContextRequest;
import com.repolens.core.model.Deadline;
import com.repolens.core.model.FileRecord;
import com.repolens.core.model.KeywordSet;
import com.repolens.core.model.ScoredFile;
import com.repolens.core.scanner.ScanException;
import com.repolens.core.scanner.ScanResult;
import com.repolens.core.scanner.TreeFingerprint;
import com.repolens.core.scanner.TreeScanner;
import com.repolens.core.scoring.RelevanceScorer;
import com.repolens.core.selection.BudgetedSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the context pipeline for one request: keyword extraction, cache lookup,
 * then on a miss scan, dependency mapping, scoring and budgeted selection.
 * <p>
 * Fingerprinting, scanning and mapping share one request deadline; when it passes
 * the bundle is built from what was read and flagged partial. A tree that could
 * not be fingerprinted in time has no version, so its bundle bypasses the cache. File contents are dropped from
 * the scanned records once the bundle holds its copies.
 */
public class ContextEngine {

    private static final Logger log = LoggerFactory.getLogger(ContextEngine.class);
    private static final AtomicInteger REQUEST_COUNTER = new AtomicInteger(0);

    private final TreeScanner scanner;
    private final KeywordExtractor extractor;
    private final DependencyMapper mapper;
    private final RelevanceScorer scorer;
    private final BudgetedSelector selector;
    private final ContextCache cache;
    private final Clock clock;
    private final RepoLensMetrics metrics;

    public ContextEngine(TreeScanner scanner, KeywordExtractor extractor, DependencyMapper mapper,
                         RelevanceScorer scorer, BudgetedSelector selector, ContextCache cache,
                         Clock clock, RepoLensMetrics metrics) {
        this.scanner = scanner;
        this.extractor = extractor;
        this.mapper = mapper;
        this.scorer = scorer;
        this.selector = selector;
        this.cache = cache;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Assembles the context bundle for {@code request}, from the cache when possible.
     *
     * @throws ScanException if the root is missing, not a directory or unreadable
     */
    public ContextResult assemble(ContextRequest request) throws ScanException {
        String requestId = generateRequestId();
        long start = System.nanoTime();
        String identity = isBlank(request.repositoryIdentity())
                ? TreeFingerprint.identityOf(request.root())
                : request.repositoryIdentity();
        MdcContext.setRequest(requestId, identity);
        try {
            KeywordSet keywords = extractor.extract(request.prompt());
            Deadline deadline = Deadline.after(request.timeout(), clock);
            String treeVersion = isBlank(request.treeVersion())
                    ? TreeFingerprint.compute(request.root(), request.scanOptions(), deadline).orElse(null)
                    : request.treeVersion();
            log.info("Assembling context {} for {} @ {} ({} keywords, budget {})",
                    requestId, identity, treeVersion, keywords.size(), request.budget());

            CacheLookup lookup;
            if (treeVersion == null) {
                log.warn("Tree of {} could not be fingerprinted before the deadline; result will not be cached", identity);
                lookup = new CacheLookup(runPipeline(request, keywords, deadline), false);
            } else {
                CacheKey key = CacheKey.of(identity, treeVersion, request.prompt(), keywords, request.budget());
                lookup = cache.getOrCompute(key, () -> runPipeline(request, keywords, deadline));
            }

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            ContextBundle bundle = lookup.bundle();
            if (lookup.cached()) {
                log.info("Context {} served from cache: {} files, {} tokens", requestId,
                        bundle.fileCount(), bundle.totalTokensEstimated());
            } else {
                log.info("Context {} assembled in {} ms: {} files, {} tokens, {} of {} considered{}",
                        requestId, elapsedMs, bundle.fileCount(), bundle.totalTokensEstimated(),
                        bundle.filesConsideredCount(), bundle.filesDiscoveredCount(),
                        bundle.partial() ? " (partial)" : "");
            }
            if (metrics != null) {
                metrics.recordContextDuration(elapsedMs, lookup.cached());
            }
            return new ContextResult(requestId, identity, treeVersion, keywords, bundle, lookup.cached(), elapsedMs);
        } finally {
            MdcContext.clear();
        }
    }

    private ContextBundle runPipeline(ContextRequest request, KeywordSet keywords, Deadline deadline)
            throws ScanException {
        ScanResult scan;
        try {
            scan = scanner.scan(request.root(), request.scanOptions(), deadline);
        } catch (RejectedExecutionException e) {
            throw new ContextAssemblyException("Scan pool rejected read tasks", e);
        }
        try {
            MappingResult mapping = mapper.buildGraph(scan.files(), deadline);
            List<ScoredFile> scored = scorer.score(scan.files(), keywords, mapping.graph());
            ContextBundle bundle = selector.select(scored, request.budget())
                    .withScanOutcome(scan.discoveredCount(), scan.partial() || mapping.partial());

            if (metrics != null) {
                if (bundle.partial()) {
                    metrics.recordPartialScan();
                }
                metrics.recordBundle(bundle.fileCount(), bundle.totalTokensEstimated());
            }
            return bundle;
        } finally {
            scan.files().forEach(FileRecord::discardContent);
        }
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public int clearCache() {
        return cache.clear();
    }

    /**
     * Generates a request ID in the format CTX-YYYYMMDD-NNNN.
     */
    String generateRequestId() {
        int count = REQUEST_COUNTER.incrementAndGet();
        var date = clock.instant().atZone(ZoneOffset.UTC).toLocalDate();
        return String.format("CTX-%d%02d%02d-%04d", date.getYear(), date.getMonthValue(), date.getDayOfMonth(), count);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
