package com.github.linkfetch.exception;

import java.nio.file.Path;

/**
 * Exception thrown when a directory cannot be created or a file cannot be written.
 */
public class StorageException extends DownloadException {

    private final Path path;

    public StorageException(String message, Throwable cause, Path path) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
