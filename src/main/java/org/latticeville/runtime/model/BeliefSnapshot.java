package org.latticeville.runtime.model;

import java.util.Map;

/**
 * Immutable copy of one agent's belief state.
 *
 * @param agentId      The owning agent.
 * @param nodes        Believed nodes in order of first perception.
 * @param objectStates Believed object attributes.
 * @param refreshedAt  Tick of the last refresh per node id.
 */
public record BeliefSnapshot(
        String agentId,
        Map<String, NodeSnapshot> nodes,
        Map<String, Map<String, String>> objectStates,
        Map<String, Long> refreshedAt) {

    public BeliefSnapshot {
        nodes = FrozenMaps.copyOf(nodes);
        objectStates = FrozenMaps.deepCopyOf(objectStates);
        refreshedAt = FrozenMaps.copyOf(refreshedAt);
    }

    /**
     * @param id A node id.
     * @return Whether the node is believed to exist.
     */
    public boolean knows(String id) {
        return nodes.containsKey(id);
    }
}
