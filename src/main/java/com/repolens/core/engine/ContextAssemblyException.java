package com.repolens.core.engine;

/**
 * Unexpected failure while assembling a context bundle, e.g. the read pool has
 * been shut down. Distinct from {@link com.repolens.core.scanner.ScanException},
 * which reports a bad scan root.
 */
public class ContextAssemblyException extends RuntimeException {

    public ContextAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
