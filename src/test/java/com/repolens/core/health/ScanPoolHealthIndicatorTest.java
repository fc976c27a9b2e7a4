package com.repolens.core.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScanPoolHealthIndicatorTest {

    private static ScanPoolHealthIndicator indicatorFor(HealthStatus status) {
        var service = mock(HealthCheckService.class);
        when(service.checkScanPool()).thenReturn(status);
        return new ScanPoolHealthIndicator(service);
    }

    @Test
    @DisplayName("maps UP with pool metadata as details")
    void up() {
        var health = indicatorFor(new HealthStatus("scan-pool", HealthStatus.Status.UP,
                "8 scan workers available", Map.of("poolSize", "8"))).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("8 scan workers available", health.getDetails().get("detail"));
        assertEquals("8", health.getDetails().get("poolSize"));
    }

    @Test
    @DisplayName("maps DEGRADED and DOWN")
    void degradedAndDown() {
        assertEquals(new Status("DEGRADED"), indicatorFor(new HealthStatus("scan-pool",
                HealthStatus.Status.DEGRADED, "busy", Map.of())).health().getStatus());
        assertEquals(Status.DOWN, indicatorFor(new HealthStatus("scan-pool",
                HealthStatus.Status.DOWN, "shut down", Map.of())).health().getStatus());
    }
}
