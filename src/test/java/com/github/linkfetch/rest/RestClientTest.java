package com.github.linkfetch.rest;

import com.github.linkfetch.config.HttpClientConfig;
import com.github.linkfetch.config.LinkfetchProperties;
import com.github.linkfetch.exception.ApiException;
import com.github.linkfetch.exception.NetworkException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RestClient")
class RestClientTest {

    private MockWebServer server;
    private RestClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        LinkfetchProperties properties = new LinkfetchProperties();
        properties.getClient().setUserAgent("linkfetch-test/1.0");
        client = new RestClient(new HttpClientConfig(properties).okHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("should decode a JSON body")
    void shouldDecodeJsonBody() throws InterruptedException {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json; charset=utf-8")
                .setBody("{\"data\":{\"id\":\"abc\"}}"));

        RestResponse response = client.get(server.url("/thing").toString());

        assertEquals(200, response.getCode());
        assertEquals("abc", response.getJson().path("data").path("id").asText());
        assertTrue(response.getContentType().startsWith("application/json"));

        RecordedRequest request = server.takeRequest();
        assertEquals("application/json", request.getHeader("Accept"));
        assertEquals("linkfetch-test/1.0", request.getHeader("User-Agent"));
    }

    @Test
    @DisplayName("caller headers should be sent and win over defaults")
    void callerHeadersShouldWin() throws InterruptedException {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{}"));

        client.get(server.url("/thing").toString(), Map.of(
                "Authorization", "Client-ID abc",
                "User-Agent", "custom"));

        RecordedRequest request = server.takeRequest();
        assertEquals("Client-ID abc", request.getHeader("Authorization"));
        assertEquals("custom", request.getHeader("User-Agent"));
    }

    @Test
    @DisplayName("non-JSON body should be rejected")
    void nonJsonBodyShouldBeRejected() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/html").setBody("<html></html>"));

        ApiException ex = assertThrows(ApiException.class, () -> client.get(server.url("/page").toString()));

        assertTrue(ex.getMessage().contains("text/html"));
    }

    @Test
    @DisplayName("malformed JSON should be rejected")
    void malformedJsonShouldBeRejected() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{nope"));

        assertThrows(ApiException.class, () -> client.get(server.url("/thing").toString()));
    }

    @Test
    @DisplayName("empty body should decode to a missing node")
    void emptyBodyShouldDecodeToMissingNode() {
        server.enqueue(new MockResponse().setResponseCode(204));

        RestResponse response = client.get(server.url("/thing").toString());

        assertTrue(response.getJson().isMissingNode());
        assertEquals("", response.getRaw());
    }

    @Test
    @DisplayName("transport failure should become a NetworkException")
    void transportFailureShouldBecomeNetworkException() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String url = stopped.url("/thing").toString();
        stopped.shutdown();

        NetworkException ex = assertThrows(NetworkException.class, () -> client.get(url));

        assertNull(ex.getStatusCode());
    }
}
