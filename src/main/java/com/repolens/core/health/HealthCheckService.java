package com.repolens.core.health;

import com.repolens.core.engine.ContextEngine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

@Service
public class HealthCheckService {

    private final ContextEngine contextEngine;
    private final ThreadPoolExecutor scanPool;

    public HealthCheckService(
            @Autowired(required = false) ContextEngine contextEngine,
            @Autowired(required = false) ThreadPoolExecutor scanPool) {
        this.contextEngine = contextEngine;
        this.scanPool = scanPool;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkEngine());
        results.add(checkScanPool());
        results.add(checkCache());
        return results;
    }

    private HealthStatus checkEngine() {
        if (contextEngine != null) {
            return new HealthStatus("engine", HealthStatus.Status.UP,
                    "Context engine available", Map.of());
        }
        return new HealthStatus("engine", HealthStatus.Status.DOWN,
                "Context engine not available", Map.of());
    }

    HealthStatus checkScanPool() {
        if (scanPool == null) {
            return new HealthStatus("scan-pool", HealthStatus.Status.DOWN,
                    "No scan pool configured", Map.of());
        }
        var metadata = Map.of(
                "poolSize", String.valueOf(scanPool.getMaximumPoolSize()),
                "active", String.valueOf(scanPool.getActiveCount()),
                "queued", String.valueOf(scanPool.getQueue().size()));
        if (scanPool.isShutdown()) {
            return new HealthStatus("scan-pool", HealthStatus.Status.DOWN,
                    "Scan pool is shut down", metadata);
        }
        if (scanPool.getActiveCount() >= scanPool.getMaximumPoolSize() && !scanPool.getQueue().isEmpty()) {
            return new HealthStatus("scan-pool", HealthStatus.Status.DEGRADED,
                    "All " + scanPool.getMaximumPoolSize() + " scan workers busy, "
                            + scanPool.getQueue().size() + " reads queued", metadata);
        }
        return new HealthStatus("scan-pool", HealthStatus.Status.UP,
                scanPool.getMaximumPoolSize() + " scan workers available", metadata);
    }

    private HealthStatus checkCache() {
        if (contextEngine == null) {
            return new HealthStatus("cache", HealthStatus.Status.DOWN,
                    "Context cache not available", Map.of());
        }
        var stats = contextEngine.cacheStats();
        return new HealthStatus("cache", HealthStatus.Status.UP,
                stats.size() + "/" + stats.capacity() + " entries",
                Map.of("hits", String.valueOf(stats.hits()),
                        "misses", String.valueOf(stats.misses()),
                        "evictions", String.valueOf(stats.evictions())));
    }
}
