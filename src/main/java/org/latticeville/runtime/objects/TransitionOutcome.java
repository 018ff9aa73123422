package org.latticeville.runtime.objects;

import java.util.Map;

import org.latticeville.runtime.model.FrozenMaps;

/**
 * Result of consulting a transition table.
 *
 * @param nextState    Attributes after the transition (unchanged on failure).
 * @param success      Whether the transition happened.
 * @param narrationKey Template key describing the outcome.
 */
public record TransitionOutcome(Map<String, String> nextState, boolean success, String narrationKey) {

    public TransitionOutcome {
        nextState = FrozenMaps.copyOf(nextState);
    }
}
