package com.github.linkfetch.service;

import com.github.linkfetch.exception.DownloadException;
import com.github.linkfetch.model.BatchResult;
import com.github.linkfetch.model.DownloadProgress;

import java.nio.file.Path;

/**
 * Receives the lifecycle events of an asynchronous download. Every method has a
 * no-op default, so callers only override what they need.
 * <p>
 * Methods are called from HTTP worker threads, possibly concurrently for
 * different targets.
 */
public interface DownloadTracker {

    /**
     * Tracker that ignores every event.
     */
    DownloadTracker NONE = new DownloadTracker() {
    };

    /**
     * Called after each chunk written to disk.
     */
    default void onProgress(DownloadProgress progress) {
    }

    /**
     * Called once when a target has been written to disk.
     */
    default void onSuccess(String sourceUrl, Path file) {
    }

    /**
     * Called once when a target could not be downloaded.
     */
    default void onFailure(String sourceUrl, DownloadException error) {
    }

    /**
     * Called exactly once per batch, after every target has succeeded or failed.
     */
    default void onBatchComplete(BatchResult result) {
    }
}
