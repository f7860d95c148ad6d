package com.github.linkfetch.model;

import com.github.linkfetch.exception.DownloadException;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Result of fetching a single target: either the file that was written or the
 * error that stopped it.
 */
@Data
@Builder
public class FetchOutcome {

    /**
     * Target URL the file was fetched from.
     */
    private final String sourceUrl;

    /**
     * SUCCEEDED or FAILED.
     */
    private final FetchStatus status;

    /**
     * Written file, null on failure.
     */
    private final Path file;

    /**
     * Cause of the failure, null on success.
     */
    private final DownloadException error;

    public static FetchOutcome success(String sourceUrl, Path file) {
        return FetchOutcome.builder()
                .sourceUrl(sourceUrl)
                .status(FetchStatus.SUCCEEDED)
                .file(file)
                .build();
    }

    public static FetchOutcome failure(String sourceUrl, DownloadException error) {
        return FetchOutcome.builder()
                .sourceUrl(sourceUrl)
                .status(FetchStatus.FAILED)
                .error(error)
                .build();
    }

    public boolean isSuccess() {
        return status == FetchStatus.SUCCEEDED;
    }
}
