package com.github.linkfetch.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exception Hierarchy")
class ExceptionHierarchyTest {

    @Nested
    @DisplayName("DownloadException")
    class DownloadExceptionTests {

        @Test
        @DisplayName("should extend RuntimeException")
        void shouldExtendRuntimeException() {
            assertInstanceOf(RuntimeException.class, new DownloadException("Test error"));
        }

        @Test
        @DisplayName("should create with message and cause")
        void shouldCreateWithMessageAndCause() {
            Exception cause = new RuntimeException("Root cause");
            DownloadException ex = new DownloadException("Download failed", cause);

            assertEquals("Download failed", ex.getMessage());
            assertEquals(cause, ex.getCause());
        }
    }

    @Nested
    @DisplayName("NetworkException")
    class NetworkExceptionTests {

        @Test
        @DisplayName("should carry the status code in field and message")
        void shouldCarryStatusCode() {
            NetworkException ex = new NetworkException(404, "https://example.com/a.png");

            assertEquals(Integer.valueOf(404), ex.getStatusCode());
            assertEquals("https://example.com/a.png", ex.getUrl());
            assertTrue(ex.getMessage().contains("404"));
        }

        @Test
        @DisplayName("should have no status code for transport failures")
        void shouldHaveNoStatusCodeForTransportFailures() {
            Exception cause = new java.io.IOException("Connection reset");
            NetworkException ex = new NetworkException("Request failed", cause, "https://example.com");

            assertNull(ex.getStatusCode());
            assertEquals(cause, ex.getCause());
        }
    }

    @Nested
    @DisplayName("ApiException")
    class ApiExceptionTests {

        @Test
        @DisplayName("should be a ResolutionException")
        void shouldBeResolutionException() {
            ApiException ex = new ApiException("Imgur API returned an error: nope", "Imgur", "https://api.imgur.com");

            assertInstanceOf(ResolutionException.class, ex);
            assertEquals("Imgur", ex.getProvider());
            assertEquals("https://api.imgur.com", ex.getUrl());
        }
    }

    @Nested
    @DisplayName("ContentTypeException")
    class ContentTypeExceptionTests {

        @Test
        @DisplayName("should describe a rejected content type")
        void shouldDescribeRejectedContentType() {
            ContentTypeException ex = new ContentTypeException("image/jpeg", Set.of("image/png"), "u");

            assertEquals("image/jpeg", ex.getContentType());
            assertEquals(Set.of("image/png"), ex.getAcceptableContentTypes());
            assertTrue(ex.getMessage().contains("image/jpeg"));
        }

        @Test
        @DisplayName("should describe a missing content type")
        void shouldDescribeMissingContentType() {
            ContentTypeException ex = new ContentTypeException(null, Set.of("image/png"), "u");

            assertEquals("No Content-Type header returned", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("ConfigurationException")
    class ConfigurationExceptionTests {

        @Test
        @DisplayName("should capture config key and value")
        void shouldCaptureConfigKeyAndValue() {
            ConfigurationException ex = new ConfigurationException(
                    "Invalid value", "linkfetch.download.create-directories", "false");

            assertEquals("linkfetch.download.create-directories", ex.getConfigKey());
            assertEquals("false", ex.getConfigValue());
        }
    }

    @Test
    @DisplayName("all custom exceptions should be catchable as DownloadException")
    void allCustomExceptionsShouldBeCatchableAsDownloadException() {
        assertInstanceOf(DownloadException.class, new ResolutionException("Test", "u"));
        assertInstanceOf(DownloadException.class, new ApiException("Test", "p", "u"));
        assertInstanceOf(DownloadException.class, new NetworkException(500, "u"));
        assertInstanceOf(DownloadException.class, new ContentTypeException("a/b", Set.of(), "u"));
        assertInstanceOf(DownloadException.class, new ConfigurationException("Test", "key"));
        assertInstanceOf(DownloadException.class, new StorageException("Test", null, Path.of("x")));
    }
}
