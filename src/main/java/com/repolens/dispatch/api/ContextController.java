package com.repolens.dispatch.api;

import com.repolens.core.cache.CacheStats;
import com.repolens.core.config.ContextRequestFactory;
import com.repolens.core.engine.ContextEngine;
import com.repolens.core.engine.ContextResult;
import com.repolens.core.model.ContextRequest;
import com.repolens.core.render.ContextRenderer;
import com.repolens.core.scanner.ScanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for context assembly and the context cache.
 */
@RestController
@RequestMapping("/api/v1/context")
public class ContextController {

    private static final Logger log = LoggerFactory.getLogger(ContextController.class);

    private final ContextEngine contextEngine;
    private final ContextRequestFactory requestFactory;
    private final ContextRenderer renderer;

    public ContextController(ContextEngine contextEngine, ContextRequestFactory requestFactory,
                             ContextRenderer renderer) {
        this.contextEngine = contextEngine;
        this.requestFactory = requestFactory;
        this.renderer = renderer;
    }

    /**
     * POST /api/v1/context
     * <p>
     * Returns the bundle synchronously. 400 on a missing prompt or path or an invalid
     * limit, 404 when the path is not a readable directory.
     */
    @PostMapping
    public ResponseEntity<?> assemble(@RequestBody ContextRequestBody body) {
        if (body.prompt() == null || body.prompt().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "prompt is required"));
        }
        if (body.projectPath() == null || body.projectPath().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "project_path is required"));
        }
        String format = body.format() == null ? "json" : body.format().toLowerCase(Locale.ROOT);
        if (!format.equals("json") && !format.equals("text")) {
            return ResponseEntity.badRequest().body(Map.of("error", "format must be json or text"));
        }

        ContextRequest request;
        try {
            request = requestFactory.forPrompt(Path.of(body.projectPath()), body.prompt())
                    .repositoryId(body.repositoryId())
                    .treeVersion(body.treeVersion())
                    .maxTokens(body.maxTokens())
                    .maxFiles(body.maxFiles())
                    .maxCharsPerFile(body.maxCharsPerFile())
                    .maxDepth(body.maxDepth())
                    .timeoutSeconds(body.timeoutSeconds())
                    .excludes(body.exclude())
                    .build();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        try {
            ContextResult result = contextEngine.assemble(request);
            return ResponseEntity.ok(format.equals("text")
                    ? ContextResponse.rendered(result, renderer.render(result.bundle(), request.root()))
                    : ContextResponse.from(result));
        } catch (ScanException e) {
            log.warn("Rejected context request for {}: {}", e.getRoot(), e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/context/cache
     */
    @GetMapping("/cache")
    public ResponseEntity<Map<String, Object>> cacheStats() {
        CacheStats stats = contextEngine.cacheStats();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("size", stats.size());
        result.put("capacity", stats.capacity());
        result.put("ttl_seconds", stats.ttlSeconds());
        result.put("hits", stats.hits());
        result.put("misses", stats.misses());
        result.put("evictions", stats.evictions());
        result.put("invalidations", stats.invalidations());
        result.put("in_flight", stats.inFlight());
        return ResponseEntity.ok(result);
    }

    /**
     * DELETE /api/v1/context/cache
     */
    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        int cleared = contextEngine.clearCache();
        log.info("Cleared {} cached context bundles", cleared);
        return ResponseEntity.ok(Map.of("cleared", cleared));
    }
}
