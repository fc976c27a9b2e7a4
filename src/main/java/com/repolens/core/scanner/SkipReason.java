package com.repolens.core.scanner;

/**
 * Why the scanner left a file out of its result.
 */
public enum SkipReason {
    /** Larger than the configured maximum file size. */
    TOO_LARGE,
    /** Content contains a NUL byte near the start. */
    BINARY,
    /** Matched an exclusion rule or is a link leaving the root. */
    EXCLUDED,
    /** The file could not be read. Marks the scan partial. */
    READ_ERROR,
    /** The deadline passed before the file was read. Marks the scan partial. */
    TIMEOUT;

    public boolean degradesResult() {
        return this == READ_ERROR || this == TIMEOUT;
    }
}
