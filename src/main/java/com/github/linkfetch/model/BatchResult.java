package com.github.linkfetch.model;

import com.github.linkfetch.exception.DownloadException;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of every target derived from one asynchronous download call.
 * URL lists are in settlement order.
 */
@Data
@Builder
public class BatchResult {

    /**
     * URL the caller asked to download, before resolution.
     */
    private final String requestUrl;

    /**
     * Number of resolved targets, always succeeded.size() + failed.size().
     */
    private final int total;

    private final List<String> succeeded;

    private final List<String> failed;

    /**
     * Written file per succeeded target.
     */
    private final Map<String, Path> files;

    /**
     * Failure per failed target.
     */
    private final Map<String, DownloadException> errors;

    public boolean isAllSucceeded() {
        return failed.isEmpty();
    }
}
