package com.repolens.core.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Utility for managing RepoLens-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String REQUEST_ID = "requestId";
    public static final String REPOSITORY = "repository";

    private MdcContext() {}

    public static void setRequest(String requestId, String repository) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(REPOSITORY, repository);
    }

    public static String requestId() {
        return MDC.get(REQUEST_ID);
    }

    /**
     * Wraps a task so it runs with the caller's MDC keys on a pool thread.
     * The worker's own MDC is cleared afterwards.
     */
    public static <T> Callable<T> propagate(Callable<T> task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            if (captured != null) {
                MDC.setContextMap(captured);
            }
            try {
                return task.call();
            } finally {
                clear();
            }
        };
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        MDC.remove(REPOSITORY);
    }
}
