package com.github.linkfetch.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.linkfetch.exception.ApiException;
import com.github.linkfetch.util.DownloadConstants;
import lombok.Getter;
import okhttp3.Headers;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * Decoded response of a JSON API call.
 */
@Getter
public class RestResponse {

    /**
     * All headers received from the server.
     */
    private final Headers headers;

    /**
     * Root node of the body. A MissingNode when the body was empty.
     */
    private final JsonNode json;

    /**
     * Raw body text.
     */
    private final String raw;

    /**
     * Content-Type header, null if absent.
     */
    private final String contentType;

    private final int code;

    RestResponse(Headers headers, JsonNode json, String raw, String contentType, int code) {
        this.headers = headers;
        this.json = json;
        this.raw = raw;
        this.contentType = contentType;
        this.code = code;
    }

    /**
     * Read and decode the body of an API response.
     *
     * @throws ApiException if the body is non-empty and not declared as JSON, or does not parse
     * @throws IOException if the body cannot be read
     */
    static RestResponse from(Response response, ObjectMapper objectMapper) throws IOException {
        String url = response.request().url().toString();
        ResponseBody body = response.body();
        String raw = body != null ? body.string() : "";
        String contentType = response.header(DownloadConstants.HEADER_CONTENT_TYPE);

        if (!raw.isEmpty() && (contentType == null || !contentType.startsWith(DownloadConstants.JSON_MEDIA_TYPE))) {
            throw new ApiException("Content type was not " + DownloadConstants.JSON_MEDIA_TYPE
                    + " (was '" + contentType + "')", null, url);
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ApiException("Malformed JSON response from " + url, e, null, url);
        }

        return new RestResponse(response.headers(), json, raw, contentType, response.code());
    }
}
