package com.repolens.core.health;

import com.repolens.core.cache.CacheStats;
import com.repolens.core.engine.ContextEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static ThreadPoolExecutor pool(int size) {
        return new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>());
    }

    private static HealthStatus find(List<HealthStatus> results, String component) {
        return results.stream().filter(s -> component.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("All components null -> all DOWN")
    void allComponentsNullAllDown() {
        var service = new HealthCheckService(null, null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(3, results.size());
        for (var status : results) {
            assertEquals(HealthStatus.Status.DOWN, status.status(),
                    status.component() + " should be DOWN when null");
        }
    }

    @Test
    @DisplayName("checkAll returns engine, scan-pool, cache components")
    void checkAllReturnsAllComponents() {
        var components = new HealthCheckService(null, null).checkAll().stream()
                .map(HealthStatus::component).toList();
        assertEquals(List.of("engine", "scan-pool", "cache"), components);
    }

    @Test
    @DisplayName("Engine available -> engine and cache UP with cache counters")
    void engineAvailable() {
        var engine = mock(ContextEngine.class);
        when(engine.cacheStats()).thenReturn(new CacheStats(3, 256, 600, 10, 4, 1, 0, 0));
        var executor = pool(2);
        try {
            var results = new HealthCheckService(engine, executor).checkAll();

            assertEquals(HealthStatus.Status.UP, find(results, "engine").status());
            var cache = find(results, "cache");
            assertEquals(HealthStatus.Status.UP, cache.status());
            assertEquals("3/256 entries", cache.detail());
            assertEquals("10", cache.metadata().get("hits"));
            assertEquals(HealthStatus.Status.UP, find(results, "scan-pool").status());
            assertEquals("2", find(results, "scan-pool").metadata().get("poolSize"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Shut down pool -> scan-pool DOWN")
    void shutDownPool() {
        var executor = pool(1);
        executor.shutdown();

        var status = new HealthCheckService(null, executor).checkScanPool();

        assertEquals(HealthStatus.Status.DOWN, status.status());
    }

    @Test
    @DisplayName("Busy pool with queued reads -> scan-pool DEGRADED")
    void saturatedPool() throws Exception {
        var executor = pool(1);
        var running = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        try {
            executor.submit(() -> {
                running.countDown();
                release.await();
                return null;
            });
            executor.submit(() -> { });
            assertTrue(running.await(5, TimeUnit.SECONDS));

            var status = new HealthCheckService(null, executor).checkScanPool();

            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertEquals("1", status.metadata().get("queued"));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }
}
