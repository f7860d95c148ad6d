package com.github.linkfetch.service.state;

import com.github.linkfetch.model.FetchStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for the fetch of a single download target.
 *
 * Valid state flow:
 * <pre>
 * PENDING → SUCCEEDED
 *    ↓
 *  FAILED
 * </pre>
 * Both settled states are terminal.
 */
@Component
@Slf4j
public class FetchStateMachine {

    private final Map<FetchStatus, Set<FetchStatus>> validTransitions;

    public FetchStateMachine() {
        validTransitions = new EnumMap<>(FetchStatus.class);
        validTransitions.put(FetchStatus.PENDING, EnumSet.of(FetchStatus.SUCCEEDED, FetchStatus.FAILED));
        validTransitions.put(FetchStatus.SUCCEEDED, EnumSet.noneOf(FetchStatus.class));
        validTransitions.put(FetchStatus.FAILED, EnumSet.noneOf(FetchStatus.class));
    }

    /**
     * Check if a state transition is valid. Staying in the same state is always valid.
     */
    public boolean isValidTransition(@NonNull FetchStatus currentState, @NonNull FetchStatus newState) {
        if (currentState == newState) {
            return true;
        }

        Set<FetchStatus> allowedTransitions = validTransitions.get(currentState);
        return allowedTransitions != null && allowedTransitions.contains(newState);
    }

    /**
     * Validate and perform state transition with exception on failure.
     *
     * @param target Target URL for logging
     * @param currentState Current state
     * @param newState Desired new state
     * @return New state
     * @throws IllegalStateException if transition is invalid
     */
    public FetchStatus transitionOrThrow(
            @NonNull String target,
            @NonNull FetchStatus currentState,
            @NonNull FetchStatus newState) {

        if (!isValidTransition(currentState, newState)) {
            throw new IllegalStateException(String.format(
                    "Invalid state transition for %s: %s → %s", target, currentState, newState));
        }

        if (currentState != newState) {
            log.debug("Target {} state transition: {} → {}", target, currentState, newState);
        }
        return newState;
    }

    /**
     * Check if a state is terminal (no further transitions possible).
     */
    public boolean isTerminalState(@NonNull FetchStatus state) {
        Set<FetchStatus> allowedTransitions = validTransitions.get(state);
        return allowedTransitions == null || allowedTransitions.isEmpty();
    }

    public Set<FetchStatus> getValidNextStates(@NonNull FetchStatus currentState) {
        Set<FetchStatus> states = validTransitions.get(currentState);
        return states != null && !states.isEmpty() ? EnumSet.copyOf(states) : EnumSet.noneOf(FetchStatus.class);
    }
}
