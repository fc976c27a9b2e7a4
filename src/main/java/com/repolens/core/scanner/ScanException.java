package com.repolens.core.scanner;

import java.nio.file.Path;

/**
 * The scan root is missing, is not a directory, or cannot be read.
 * This is the only scanner condition that aborts a context request.
 */
public class ScanException extends Exception {

    private final Path root;

    public ScanException(Path root, String message) {
        super(message + ": " + root);
        this.root = root;
    }

    public ScanException(Path root, String message, Throwable cause) {
        super(message + ": " + root, cause);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
