package com.github.linkfetch.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What to download, where to put it, and which Content-Types are acceptable.
 * An empty set of content types accepts any response. The request is shared by
 * every target resolved from {@link #getUrl()} and is never mutated.
 */
@Value
public class DownloadRequest {

    String url;
    Path directory;
    Set<String> acceptableContentTypes;

    @Builder
    public DownloadRequest(@NonNull String url, @NonNull Path directory, Set<String> acceptableContentTypes) {
        this.url = url;
        this.directory = directory;
        this.acceptableContentTypes = acceptableContentTypes == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(acceptableContentTypes));
    }

    public static DownloadRequest of(String url, Path directory, String... contentTypes) {
        return new DownloadRequest(url, directory, new LinkedHashSet<>(Arrays.asList(contentTypes)));
    }

    /**
     * Checks the given Content-Type against {@link #getAcceptableContentTypes()}
     * by prefix, so "image/png" accepts "image/png; charset=utf-8".
     *
     * @param contentType Content-Type header of the response, may be null
     * @return true if acceptable
     */
    public boolean accepts(String contentType) {
        if (acceptableContentTypes.isEmpty()) {
            return true;
        }
        if (contentType == null || contentType.isEmpty()) {
            return false;
        }
        return acceptableContentTypes.stream().anyMatch(contentType::startsWith);
    }
}
