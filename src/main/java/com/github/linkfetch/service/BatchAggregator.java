package com.github.linkfetch.service;

import com.github.linkfetch.exception.DownloadException;
import com.github.linkfetch.model.BatchResult;
import com.github.linkfetch.model.FetchOutcome;
import com.github.linkfetch.model.FetchStatus;
import com.github.linkfetch.service.state.FetchStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the outcomes of the concurrent fetches of one batch. All state is
 * guarded by this object's monitor.
 */
@Slf4j
public class BatchAggregator {

    private final String requestUrl;
    private final FetchStateMachine stateMachine;
    private final Map<String, FetchStatus> states = new LinkedHashMap<>();
    private final List<String> succeeded = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();
    private final Map<String, Path> files = new LinkedHashMap<>();
    private final Map<String, DownloadException> errors = new LinkedHashMap<>();
    private boolean completed;

    public BatchAggregator(String requestUrl, Collection<String> targets, FetchStateMachine stateMachine) {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one target");
        }
        this.requestUrl = requestUrl;
        this.stateMachine = stateMachine;
        for (String target : targets) {
            states.put(target, FetchStatus.PENDING);
        }
    }

    /**
     * Record the outcome of one target.
     *
     * @param outcome Settled fetch
     * @return The batch result if this outcome settled the last pending target, empty otherwise
     * @throws IllegalArgumentException if the target is not part of this batch
     */
    public synchronized Optional<BatchResult> record(FetchOutcome outcome) {
        String target = outcome.getSourceUrl();
        FetchStatus current = states.get(target);
        if (current == null) {
            throw new IllegalArgumentException("Not a target of this batch: " + target);
        }

        if (stateMachine.isTerminalState(current)) {
            log.warn("Ignoring {} outcome for {}, already {}", outcome.getStatus(), target, current);
            return Optional.empty();
        }

        states.put(target, stateMachine.transitionOrThrow(target, current, outcome.getStatus()));
        if (outcome.isSuccess()) {
            succeeded.add(target);
            files.put(target, outcome.getFile());
        } else {
            failed.add(target);
            errors.put(target, outcome.getError());
        }

        if (completed || getSettledCount() < states.size()) {
            return Optional.empty();
        }

        completed = true;
        log.debug("Batch for {} complete: {} succeeded, {} failed", requestUrl, succeeded.size(), failed.size());
        return Optional.of(BatchResult.builder()
                .requestUrl(requestUrl)
                .total(states.size())
                .succeeded(List.copyOf(succeeded))
                .failed(List.copyOf(failed))
                .files(new LinkedHashMap<>(files))
                .errors(new LinkedHashMap<>(errors))
                .build());
    }

    public synchronized int getSettledCount() {
        return succeeded.size() + failed.size();
    }

    public int getTotal() {
        return states.size();
    }

    public synchronized boolean isComplete() {
        return completed;
    }

    public synchronized FetchStatus getStatus(String target) {
        return states.get(target);
    }
}
