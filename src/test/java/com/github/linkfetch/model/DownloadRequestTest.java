package com.github.linkfetch.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DownloadRequest")
class DownloadRequestTest {

    private static final Path DIR = Path.of("downloads");

    @Nested
    @DisplayName("accepts")
    class AcceptsTests {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"image/png", "text/html; charset=utf-8"})
        @DisplayName("empty acceptable set should accept anything, even no Content-Type")
        void emptySetShouldAcceptAnything(String contentType) {
            assertTrue(DownloadRequest.of("https://example.com/a", DIR).accepts(contentType));
        }

        @Test
        @DisplayName("should accept by prefix")
        void shouldAcceptByPrefix() {
            DownloadRequest request = DownloadRequest.of("https://example.com/a", DIR, "image/png");

            assertTrue(request.accepts("image/png"));
            assertTrue(request.accepts("image/png; charset=utf-8"));
        }

        @Test
        @DisplayName("should reject other types")
        void shouldRejectOtherTypes() {
            DownloadRequest request = DownloadRequest.of("https://example.com/a", DIR, "image/png");

            assertFalse(request.accepts("image/jpeg"));
            assertFalse(request.accepts("image"));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @DisplayName("non-empty acceptable set should reject a missing Content-Type")
        void nonEmptySetShouldRejectMissingContentType(String contentType) {
            assertFalse(DownloadRequest.of("https://example.com/a", DIR, "image/png").accepts(contentType));
        }

        @Test
        @DisplayName("should accept if any entry matches")
        void shouldAcceptIfAnyEntryMatches() {
            DownloadRequest request = DownloadRequest.of("u", DIR, "image/jpeg", "image/png", "image/gif");

            assertTrue(request.accepts("image/gif"));
        }
    }

    @Test
    @DisplayName("should not be affected by later changes to the given set")
    void shouldCopyContentTypes() {
        Set<String> types = new HashSet<>(Set.of("image/png"));
        DownloadRequest request = DownloadRequest.builder()
                .url("https://example.com/a")
                .directory(DIR)
                .acceptableContentTypes(types)
                .build();

        types.add("video/webm");

        assertEquals(Set.of("image/png"), request.getAcceptableContentTypes());
        assertThrows(UnsupportedOperationException.class, () -> request.getAcceptableContentTypes().add("x"));
    }

    @Test
    @DisplayName("null content types should mean accept any")
    void nullContentTypesShouldMeanAcceptAny() {
        DownloadRequest request = new DownloadRequest("https://example.com/a", DIR, null);

        assertTrue(request.getAcceptableContentTypes().isEmpty());
    }

    @Test
    @DisplayName("should require url and directory")
    void shouldRequireUrlAndDirectory() {
        assertThrows(NullPointerException.class, () -> new DownloadRequest(null, DIR, Set.of()));
        assertThrows(NullPointerException.class, () -> new DownloadRequest("u", null, Set.of()));
    }
}
