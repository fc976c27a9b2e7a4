package com.repolens.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setRequest puts requestId and repository in MDC")
    void setRequest() {
        MdcContext.setRequest("CTX-20260301-0001", "acme/shop");
        assertEquals("CTX-20260301-0001", MDC.get("requestId"));
        assertEquals("acme/shop", MDC.get("repository"));
        assertEquals("CTX-20260301-0001", MdcContext.requestId());
    }

    @Test
    @DisplayName("clear removes all repolens MDC keys")
    void clear() {
        MdcContext.setRequest("CTX-20260301-0001", "acme/shop");
        MdcContext.clear();
        assertNull(MDC.get("requestId"));
        assertNull(MDC.get("repository"));
    }

    @Test
    @DisplayName("propagate carries the caller's keys onto a pool thread")
    void propagate() throws Exception {
        var pool = Executors.newSingleThreadExecutor();
        try {
            MdcContext.setRequest("CTX-20260301-0007", "acme/shop");
            var seen = pool.submit(MdcContext.propagate(() -> MDC.get("requestId") + "|" + MDC.get("repository")));
            assertEquals("CTX-20260301-0007|acme/shop", seen.get(5, TimeUnit.SECONDS));

            MdcContext.clear();
            var after = pool.submit(() -> MDC.get("requestId"));
            assertNull(after.get(5, TimeUnit.SECONDS), "worker MDC should be cleared after the task");
        } finally {
            pool.shutdownNow();
        }
    }
}
