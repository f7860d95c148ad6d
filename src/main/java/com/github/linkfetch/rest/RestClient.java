package com.github.linkfetch.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.linkfetch.exception.NetworkException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * Blocking client for the JSON APIs resource identifiers talk to. Default headers
 * (User-Agent and friends) come from the shared {@link OkHttpClient}.
 */
@Slf4j
@Component
public class RestClient {

    private static final String HEADER_ACCEPT = "Accept";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public RestClient(OkHttpClient httpClient) {
        this(httpClient, new ObjectMapper());
    }

    public RestClient(OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * GET the given URL and decode its JSON body
     */
    public RestResponse get(String url) {
        return get(url, Collections.emptyMap());
    }

    /**
     * GET the given URL with extra headers (e.g. API keys) and decode its JSON body
     */
    public RestResponse get(String url, Map<String, String> headers) {
        Request.Builder builder = new Request.Builder()
                .get()
                .url(url)
                .header(HEADER_ACCEPT, "application/json");

        headers.forEach(builder::header);

        return execute(builder.build());
    }

    /**
     * Execute a prebuilt request and decode its JSON body
     */
    public RestResponse execute(Request request) {
        String url = request.url().toString();
        log.debug("API request: {} {}", request.method(), url);

        try (Response response = httpClient.newCall(request).execute()) {
            log.debug("API response {} from {}", response.code(), url);
            return RestResponse.from(response, objectMapper);
        } catch (IOException e) {
            throw new NetworkException("API request to " + url + " failed: " + e.getMessage(), e, url);
        }
    }
}
