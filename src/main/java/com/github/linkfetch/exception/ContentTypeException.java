package com.github.linkfetch.exception;

import java.util.Set;

/**
 * Thrown when a response's Content-Type is missing or matches none of the
 * acceptable content types of the request.
 */
public class ContentTypeException extends DownloadException {

    private final String contentType;
    private final Set<String> acceptableContentTypes;
    private final String url;

    public ContentTypeException(String contentType, Set<String> acceptableContentTypes, String url) {
        super(contentType == null
                ? "No Content-Type header returned"
                : "No valid content types matched the Content-Type '" + contentType + "'");
        this.contentType = contentType;
        this.acceptableContentTypes = acceptableContentTypes;
        this.url = url;
    }

    public String getContentType() {
        return contentType;
    }

    public Set<String> getAcceptableContentTypes() {
        return acceptableContentTypes;
    }

    public String getUrl() {
        return url;
    }
}
