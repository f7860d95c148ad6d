package com.github.linkfetch.exception;

/**
 * Thrown when a JSON API answers at the transport level but reports an error,
 * or answers with something that is not JSON.
 */
public class ApiException extends ResolutionException {

    private final String provider;

    public ApiException(String message, String provider, String url) {
        super(message, url);
        this.provider = provider;
    }

    public ApiException(String message, Throwable cause, String provider, String url) {
        super(message, cause, url);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
