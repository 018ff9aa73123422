package org.latticeville.runtime.perception;

import java.util.List;
import java.util.Map;

import org.latticeville.runtime.model.FrozenMaps;
import org.latticeville.runtime.model.NodeKind;
import org.latticeville.runtime.model.NodeSnapshot;

/**
 * What one agent can see at the start of a tick.
 *
 * @param agentId      The perceiving agent.
 * @param tick         The tick being decided.
 * @param locationId   The node the agent occupies.
 * @param inTransit    Whether the agent is travelling (and therefore sees only passers-by).
 * @param nodes        The location node first, then the visible children in tree order.
 * @param objectStates Attributes of every visible object.
 */
public record PerceptionSlice(
        String agentId,
        long tick,
        String locationId,
        boolean inTransit,
        List<NodeSnapshot> nodes,
        Map<String, Map<String, String>> objectStates) {

    public PerceptionSlice {
        nodes = List.copyOf(nodes);
        objectStates = FrozenMaps.deepCopyOf(objectStates);
    }

    /**
     * @return The occupied location node.
     */
    public NodeSnapshot location() {
        return nodes.get(0);
    }

    /**
     * @return Visible objects in tree order.
     */
    public List<NodeSnapshot> visibleObjects() {
        return nodes.stream().skip(1).filter(n -> n.kind() == NodeKind.OBJECT).toList();
    }

    /**
     * @return Visible agents other than the perceiving one, in tree order.
     */
    public List<NodeSnapshot> visibleAgents() {
        return nodes.stream().skip(1)
                .filter(n -> n.kind() == NodeKind.AGENT && !n.id().equals(agentId))
                .toList();
    }

    /**
     * @param id A node id.
     * @return Whether the node is part of this slice.
     */
    public boolean contains(String id) {
        for (NodeSnapshot node : nodes) {
            if (node.id().equals(id)) {
                return true;
            }
        }
        return false;
    }
}
