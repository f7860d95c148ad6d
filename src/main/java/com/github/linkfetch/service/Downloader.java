package com.github.linkfetch.service;

import com.github.linkfetch.config.LinkfetchProperties;
import com.github.linkfetch.exception.DownloadException;
import com.github.linkfetch.exception.NetworkException;
import com.github.linkfetch.exception.ResolutionException;
import com.github.linkfetch.identifier.ResourceIdentifierChain;
import com.github.linkfetch.model.BatchResult;
import com.github.linkfetch.model.DownloadProgress;
import com.github.linkfetch.model.DownloadRequest;
import com.github.linkfetch.model.FetchOutcome;
import com.github.linkfetch.service.state.FetchStateMachine;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Resolves a URL into download targets and fetches them.
 * <p>
 * The two entry points fail differently. {@link #downloadSync(DownloadRequest)}
 * stops at the first target that fails and returns nothing.
 * {@link #downloadAsync(DownloadRequest, DownloadTracker)} isolates failures per
 * target and reports what succeeded and what failed once every target has settled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Downloader {

    private final OkHttpClient httpClient;
    private final ResourceIdentifierChain identifierChain;
    private final LinkfetchProperties properties;
    private final ResponseTransfer responseTransfer;
    private final FetchStateMachine stateMachine;

    /**
     * Download synchronously, accepting the given content types or the configured
     * defaults when none are given
     */
    public Set<Path> download(String url, Path directory, String... contentTypes) {
        return downloadSync(buildRequest(url, directory, contentTypes));
    }

    /**
     * Download every target of the request one after the other.
     *
     * @param request What to download and where
     * @return Written files in target order, empty if the URL resolved to no targets
     * @throws ResolutionException if the URL cannot be resolved
     * @throws NetworkException if an API call made while resolving fails in transit
     * @throws DownloadException on the first target that fails; files already written stay on disk
     */
    public Set<Path> downloadSync(@NonNull DownloadRequest request) {
        log.info("Requested to download content from '{}' into '{}'", request.getUrl(), request.getDirectory());

        Set<String> targets = identifierChain.resolve(request.getUrl());
        if (targets.isEmpty()) {
            log.info("No targets found for '{}'", request.getUrl());
            return new LinkedHashSet<>();
        }

        Set<Path> downloads = new LinkedHashSet<>();
        for (String target : targets) {
            Request httpRequest = buildHttpRequest(target);
            try (Response response = httpClient.newCall(httpRequest).execute()) {
                downloads.add(responseTransfer.transfer(request, target, response, this::logProgress));
            } catch (IOException e) {
                throw new NetworkException("Request to " + target + " failed: " + e.getMessage(), e, target);
            }
        }

        return downloads;
    }

    /**
     * Download asynchronously, accepting the given content types or the configured
     * defaults when none are given
     */
    public int downloadAsync(String url, Path directory, DownloadTracker tracker, String... contentTypes) {
        return downloadAsync(buildRequest(url, directory, contentTypes), tracker);
    }

    /**
     * Resolve the request on the calling thread, then fetch every target concurrently
     * on the HTTP client's dispatcher.
     * <p>
     * A failing target is reported through {@link DownloadTracker#onFailure} and does
     * not affect its siblings. Once all targets have settled,
     * {@link DownloadTracker#onBatchComplete} fires exactly once. When the URL resolves
     * to no targets nothing is fetched and no callback fires at all.
     *
     * @param request What to download and where
     * @param tracker Receives progress and completion events, may be {@link DownloadTracker#NONE}
     * @return Number of targets dispatched, 0 if there was nothing to download
     * @throws ResolutionException if the URL cannot be resolved
     * @throws NetworkException if an API call made while resolving fails in transit
     */
    public int downloadAsync(@NonNull DownloadRequest request, @NonNull DownloadTracker tracker) {
        log.info("Enqueuing request to download content from '{}' into '{}'",
                request.getUrl(), request.getDirectory());

        Set<String> targets = identifierChain.resolve(request.getUrl());
        if (targets.isEmpty()) {
            log.info("No targets found for '{}'", request.getUrl());
            return 0;
        }

        BatchAggregator batch = new BatchAggregator(request.getUrl(), targets, stateMachine);

        for (String target : targets) {
            Request httpRequest;
            try {
                httpRequest = buildHttpRequest(target);
            } catch (DownloadException e) {
                settle(batch, tracker, FetchOutcome.failure(target, e));
                continue;
            }

            httpClient.newCall(httpRequest).enqueue(new Callback() {
                @Override
                public void onFailure(@NotNull Call call, @NotNull IOException e) {
                    settle(batch, tracker, FetchOutcome.failure(target,
                            new NetworkException("Request to " + target + " failed: " + e.getMessage(), e, target)));
                }

                @Override
                public void onResponse(@NotNull Call call, @NotNull Response response) {
                    FetchOutcome outcome;
                    try (Response r = response) {
                        Path file = responseTransfer.transfer(request, target, r, progressNotifier(tracker));
                        outcome = FetchOutcome.success(target, file);
                    } catch (DownloadException e) {
                        outcome = FetchOutcome.failure(target, e);
                    } catch (RuntimeException e) {
                        outcome = FetchOutcome.failure(target, new DownloadException(e));
                    }
                    settle(batch, tracker, outcome);
                }
            });
        }

        return targets.size();
    }

    private void settle(BatchAggregator batch, DownloadTracker tracker, FetchOutcome outcome) {
        String target = outcome.getSourceUrl();
        if (outcome.isSuccess()) {
            notify(tracker, t -> t.onSuccess(target, outcome.getFile()));
        } else {
            log.warn("Failed to download {}: {}", target, outcome.getError().getMessage());
            notify(tracker, t -> t.onFailure(target, outcome.getError()));
        }

        Optional<BatchResult> result = batch.record(outcome);
        result.ifPresent(r -> {
            log.info("Finished downloading '{}': {} of {} target(s) succeeded",
                    r.getRequestUrl(), r.getSucceeded().size(), r.getTotal());
            notify(tracker, t -> t.onBatchComplete(r));
        });
    }

    private Consumer<DownloadProgress> progressNotifier(DownloadTracker tracker) {
        return progress -> notify(tracker, t -> t.onProgress(progress));
    }

    private void notify(DownloadTracker tracker, Consumer<DownloadTracker> event) {
        try {
            event.accept(tracker);
        } catch (Exception e) {
            log.error("Error in download tracker: {}", e.getMessage(), e);
        }
    }

    private void logProgress(DownloadProgress progress) {
        if (log.isTraceEnabled()) {
            log.trace("{}: {} of {} bytes", progress.getSourceUrl(), progress.getBytesWritten(),
                    progress.getTotalBytes());
        }
    }

    private DownloadRequest buildRequest(String url, Path directory, String... contentTypes) {
        Set<String> types = contentTypes.length > 0
                ? new LinkedHashSet<>(Arrays.asList(contentTypes))
                : properties.getDownload().getAcceptableContentTypes();
        return new DownloadRequest(url, directory, types);
    }

    private Request buildHttpRequest(String target) {
        try {
            return new Request.Builder()
                    .get()
                    .url(target)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ResolutionException("Invalid download target '" + target + "'", e, target);
        }
    }
}
