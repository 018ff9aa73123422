package org.latticeville.runtime.transit;

import java.util.List;
import java.util.Optional;

import org.latticeville.runtime.event.Event;
import org.latticeville.runtime.model.CanonicalWorldState;
import org.latticeville.runtime.model.LocationGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the STATIONARY / IN_TRANSIT lifecycle of agents on a working copy of the world.
 * <p>
 * A journey begins on the tick a MOVE is executed: the agent is in transit from then on
 * but still occupies its origin. Each following tick it spends one tick on the current
 * edge; after {@code ticksPerEdge} ticks it steps onto the next node, where other agents
 * can observe it. Reaching the destination returns it to {@link TransitState#STATIONARY}
 * and yields the single {@link Event.Moved} of the journey.
 * <p>
 * A journey cannot be redirected. MOVE requests from travelling agents are refused, and
 * the valid-target stage never offers any in the first place.
 */
public class TransitStateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(TransitStateMachine.class);

    private final LocationGraph graph;
    private final int ticksPerEdge;

    /**
     * @param graph        The location graph.
     * @param ticksPerEdge Uniform cost of one edge, in ticks. Must be at least 1.
     */
    public TransitStateMachine(LocationGraph graph, int ticksPerEdge) {
        if (ticksPerEdge < 1) {
            throw new IllegalArgumentException("ticks-per-edge must be >= 1, got " + ticksPerEdge);
        }
        this.graph = graph;
        this.ticksPerEdge = ticksPerEdge;
    }

    /**
     * Starts a journey for a stationary agent.
     *
     * @param state       The working copy.
     * @param agentId     The agent.
     * @param destination The target location.
     * @return Whether the journey was started.
     */
    public boolean begin(CanonicalWorldState state, String agentId, String destination) {
        if (state.getTransit(agentId).isInTransit()) {
            LOG.debug("Agent {} is already travelling, ignoring move to {}", agentId, destination);
            return false;
        }
        String origin = state.getAgentLocation(agentId);
        List<String> path = PathFinder.shortestPath(graph, origin, destination);
        if (path.isEmpty()) {
            LOG.debug("No path for agent {} from {} to {}", agentId, origin, destination);
            return false;
        }
        state.setTransit(agentId, new TransitState.InTransit(origin, destination, path, path.size() - 1, 0));
        LOG.debug("Agent {} starts travelling {} ({} edges)", agentId, path, path.size() - 1);
        return true;
    }

    /**
     * Advances a travelling agent by one tick. Does nothing for stationary agents.
     *
     * @param state   The working copy.
     * @param agentId The agent.
     * @return The arrival event if the agent reached its destination this tick.
     */
    public Optional<Event.Moved> advance(CanonicalWorldState state, String agentId) {
        if (!(state.getTransit(agentId) instanceof TransitState.InTransit transit)) {
            return Optional.empty();
        }
        int progress = transit.edgeProgress() + 1;
        if (progress < ticksPerEdge) {
            state.setTransit(agentId, new TransitState.InTransit(transit.origin(), transit.destination(),
                    transit.path(), transit.remainingEdges(), progress));
            return Optional.empty();
        }

        state.moveAgent(agentId, transit.nextLocation());
        int remaining = transit.remainingEdges() - 1;
        if (remaining == 0) {
            state.setTransit(agentId, TransitState.STATIONARY);
            return Optional.of(new Event.Moved(agentId, transit.origin(), transit.destination()));
        }
        state.setTransit(agentId, new TransitState.InTransit(transit.origin(), transit.destination(),
                transit.path(), remaining, 0));
        return Optional.empty();
    }

    public LocationGraph getGraph() {
        return graph;
    }

    public int getTicksPerEdge() {
        return ticksPerEdge;
    }
}
