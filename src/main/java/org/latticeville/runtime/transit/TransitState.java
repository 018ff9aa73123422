package org.latticeville.runtime.transit;

import java.util.List;

/**
 * Movement state of a single agent.
 * <p>
 * An agent is either {@link Stationary} or {@link InTransit}. Arrival is the terminal
 * transition of a journey and returns the agent to {@link #STATIONARY}.
 */
public sealed interface TransitState permits TransitState.Stationary, TransitState.InTransit {

    /** The shared stationary state. */
    Stationary STATIONARY = new Stationary();

    /**
     * @return Whether the agent is currently travelling.
     */
    default boolean isInTransit() {
        return this instanceof InTransit;
    }

    /**
     * The agent occupies a location and may act on it.
     */
    record Stationary() implements TransitState {
    }

    /**
     * The agent is walking a precomputed path.
     *
     * @param origin         The location where the journey started.
     * @param destination    The final location of the journey.
     * @param path           The full route, origin first and destination last.
     * @param remainingEdges The number of edges still to traverse.
     * @param edgeProgress   Ticks already spent on the current edge.
     */
    record InTransit(String origin, String destination, List<String> path, int remainingEdges, int edgeProgress)
            implements TransitState {

        public InTransit {
            path = List.copyOf(path);
            if (path.size() < 2) {
                throw new IllegalArgumentException("A transit path needs at least two locations, got " + path);
            }
            if (remainingEdges < 1 || remainingEdges > path.size() - 1) {
                throw new IllegalArgumentException("remainingEdges " + remainingEdges + " out of range for path " + path);
            }
        }

        /**
         * @return The location the agent occupies right now.
         */
        public String currentLocation() {
            return path.get(path.size() - 1 - remainingEdges);
        }

        /**
         * @return The location at the far end of the current edge.
         */
        public String nextLocation() {
            return path.get(path.size() - remainingEdges);
        }
    }
}
