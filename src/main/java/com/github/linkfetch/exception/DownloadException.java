package com.github.linkfetch.exception;

/**
 * Base exception for everything that can go wrong between resolving a URL and
 * writing its targets to disk.
 */
public class DownloadException extends RuntimeException {

    public DownloadException(String message) {
        super(message);
    }

    public DownloadException(String message, Throwable cause) {
        super(message, cause);
    }

    public DownloadException(Throwable cause) {
        super(cause);
    }
}
