package com.repolens.core.scanner;

public record SkippedFile(String path, SkipReason reason, String detail) {

    public SkippedFile(String path, SkipReason reason) {
        this(path, reason, null);
    }
}
