package com.github.linkfetch.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.linkfetch.exception.ApiException;

/**
 * Implemented by resource identifiers that call a JSON API. Each provider signals
 * errors its own way, so each checks the decoded body itself.
 */
public interface ApiConsumer {

    RestClient getRestClient();

    /**
     * Inspect a decoded response and fail if the provider reported an error.
     *
     * @param root Root node of the response
     * @param url Requested URL, for the error
     * @throws ApiException with the provider's message if the response signals an error
     */
    void checkForError(JsonNode root, String url);
}
