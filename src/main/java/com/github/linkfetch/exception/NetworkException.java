package com.github.linkfetch.exception;

/**
 * Thrown when a request returns a status outside of [200, 300), or when the
 * transport fails before any status is received.
 */
public class NetworkException extends DownloadException {

    private final Integer statusCode;
    private final String url;

    public NetworkException(int statusCode, String url) {
        super("Request returned unsuccessful response: " + statusCode);
        this.statusCode = statusCode;
        this.url = url;
    }

    public NetworkException(String message, Throwable cause, String url) {
        super(message, cause);
        this.statusCode = null;
        this.url = url;
    }

    /**
     * @return HTTP status code, or null when the request never got a response
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }
}
