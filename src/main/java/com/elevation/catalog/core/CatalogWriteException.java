package com.elevation.catalog.core;

import java.nio.file.Path;

/**
 * Thrown when a catalog document or feed cannot be read or written.
 */
public class CatalogWriteException extends RuntimeException {

    private final transient Path path;

    public CatalogWriteException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public CatalogWriteException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
