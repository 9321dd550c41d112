package com.formula.conversion.cache;

import java.nio.file.Path;

/**
 * Thrown when a persisted cache is unreadable, not a JSON object, or was
 * written with a different format version.
 */
public class CacheFormatException extends Exception {

    private final Path path;

    public CacheFormatException(Path path, String message) {
        super("error while reading cache from " + path + ": " + message);
        this.path = path;
    }

    public CacheFormatException(Path path, String message, Throwable cause) {
        super("error while reading cache from " + path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
