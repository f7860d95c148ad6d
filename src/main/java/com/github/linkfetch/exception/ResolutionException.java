package com.github.linkfetch.exception;

/**
 * Thrown when a URL cannot be turned into a set of download targets.
 */
public class ResolutionException extends DownloadException {

    private final String url;

    public ResolutionException(String message, String url) {
        super(message);
        this.url = url;
    }

    public ResolutionException(String message, Throwable cause, String url) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
