package org.latticeville.runtime.perception;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.latticeville.runtime.action.ValidTargets;
import org.latticeville.runtime.model.IWorldReader;
import org.latticeville.runtime.model.LocationGraph;
import org.latticeville.runtime.model.NodeKind;
import org.latticeville.runtime.model.NodeSnapshot;
import org.latticeville.runtime.model.StructuralInvariantException;

/**
 * Computes what agents see and what they may target, always against a frozen snapshot.
 * <p>
 * A stationary agent sees its area plus the objects and agents directly inside it.
 * A travelling agent sees only the node it is passing through and the agents in it:
 * it can be observed and can observe, but has nothing to interact with.
 */
public final class Perception {

    private Perception() {
    }

    /**
     * @param world   The frozen world.
     * @param agentId The perceiving agent.
     * @param tick    The tick being decided.
     * @return The agent's visible slice.
     */
    public static PerceptionSlice sliceFor(IWorldReader world, String agentId, long tick) {
        String locationId = world.getAgentLocation(agentId);
        NodeSnapshot location = locationId != null ? world.getNode(locationId) : null;
        if (location == null) {
            throw new StructuralInvariantException("Agent '" + agentId + "' has no location node");
        }
        boolean inTransit = world.getTransit(agentId).isInTransit();

        List<NodeSnapshot> nodes = new ArrayList<>();
        Map<String, Map<String, String>> objectStates = new LinkedHashMap<>();
        nodes.add(location);
        for (String childId : location.children()) {
            NodeSnapshot child = world.getNode(childId);
            if (child == null) {
                continue;
            }
            if (child.kind() == NodeKind.AGENT) {
                nodes.add(child);
            } else if (child.kind() == NodeKind.OBJECT && !inTransit) {
                nodes.add(child);
                objectStates.put(childId, world.getObjectState(childId));
            }
        }
        return new PerceptionSlice(agentId, tick, locationId, inTransit, nodes, objectStates);
    }

    /**
     * Enumerates admissible action arguments. Travelling agents get no targets at all, so
     * MOVE, INTERACT and SAY are all rejected until they are stationary again.
     *
     * @param slice The agent's slice for this tick.
     * @param graph The location graph.
     * @return The valid targets.
     */
    public static ValidTargets validTargetsFor(PerceptionSlice slice, LocationGraph graph) {
        if (slice.inTransit()) {
            return ValidTargets.NONE;
        }
        List<String> objects = slice.visibleObjects().stream().map(NodeSnapshot::id).toList();
        List<String> agents = slice.visibleAgents().stream().map(NodeSnapshot::id).toList();
        return ValidTargets.of(graph.reachableFrom(slice.locationId()), objects, agents);
    }

    /**
     * Renders a slice as a short sentence, used as the perception half of retrieval queries.
     *
     * @param slice The slice.
     * @param agentName The perceiving agent's display name.
     * @return A description such as {@code "Ada is at Cafe with Byron, Fridge."}.
     */
    public static String describe(PerceptionSlice slice, String agentName) {
        StringBuilder sb = new StringBuilder();
        sb.append(agentName).append(slice.inTransit() ? " is passing through " : " is at ")
                .append(slice.location().name());
        List<String> seen = new ArrayList<>();
        slice.visibleAgents().forEach(n -> seen.add(n.name()));
        slice.visibleObjects().forEach(n -> seen.add(n.name()));
        if (!seen.isEmpty()) {
            sb.append(" with ").append(String.join(", ", seen));
        }
        return sb.append('.').toString();
    }
}
