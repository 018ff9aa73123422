package org.latticeville.runtime.model;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.latticeville.runtime.perception.PerceptionSlice;

import it.unimi.dsi.fastutil.objects.Object2LongOpenHashMap;

/**
 * An agent's private, possibly partial and stale view of the world.
 * <p>
 * Uses the same node and attribute schema as the canonical state but only holds nodes the
 * agent has perceived, each stamped with the tick of its last refresh. The only way in is
 * {@link #merge(PerceptionSlice, long)}: perceived nodes are inserted or overwritten,
 * everything else is left as it was. Nothing is ever removed, so a node that disappeared
 * canonically stays in belief until the agent sees its former parent again (and even then
 * only the parent's children list reflects the removal).
 * <p>
 * Parent references may point at nodes the agent has never perceived.
 */
public class BeliefState {

    private final String agentId;
    private final Map<String, NodeSnapshot> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> objectStates = new LinkedHashMap<>();
    private final Object2LongOpenHashMap<String> refreshedAt = new Object2LongOpenHashMap<>();

    public BeliefState(String agentId) {
        this.agentId = agentId;
        this.refreshedAt.defaultReturnValue(-1L);
    }

    /**
     * Inserts or overwrites every node of the slice.
     *
     * @param slice The perception slice to merge.
     * @param tick  The tick to stamp on refreshed nodes.
     * @return Ids of nodes that were new or whose content changed, in slice order.
     */
    public Set<String> merge(PerceptionSlice slice, long tick) {
        Set<String> changed = new LinkedHashSet<>();
        for (NodeSnapshot node : slice.nodes()) {
            NodeSnapshot previous = nodes.put(node.id(), node);
            if (!node.equals(previous)) {
                changed.add(node.id());
            }
            if (node.kind() == NodeKind.OBJECT) {
                Map<String, String> attributes = slice.objectStates().getOrDefault(node.id(), Map.of());
                Map<String, String> before = objectStates.put(node.id(), attributes);
                if (!Objects.equals(before, attributes)) {
                    changed.add(node.id());
                }
            }
            refreshedAt.put(node.id(), tick);
        }
        return changed;
    }

    public String getAgentId() {
        return agentId;
    }

    /**
     * @param id A node id.
     * @return Whether the agent holds any belief about the node.
     */
    public boolean knows(String id) {
        return nodes.containsKey(id);
    }

    /**
     * @param id A node id.
     * @return The believed node, or {@code null} if never perceived.
     */
    public NodeSnapshot getNode(String id) {
        return nodes.get(id);
    }

    /**
     * @param id An object id.
     * @return The believed attributes, empty if unknown.
     */
    public Map<String, String> getObjectState(String id) {
        return objectStates.getOrDefault(id, Map.of());
    }

    /**
     * @param id A node id.
     * @return The tick of the last refresh, or -1 if never perceived.
     */
    public long getRefreshedAt(String id) {
        return refreshedAt.getLong(id);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @return An immutable snapshot for decision requests and payloads.
     */
    public BeliefSnapshot snapshot() {
        Map<String, Long> ticks = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            ticks.put(id, refreshedAt.getLong(id));
        }
        return new BeliefSnapshot(agentId, nodes, objectStates, ticks);
    }
}
