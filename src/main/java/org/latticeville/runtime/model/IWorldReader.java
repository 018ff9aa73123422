package org.latticeville.runtime.model;

import java.util.Map;

import org.latticeville.runtime.transit.TransitState;

/**
 * Read-only access to a world state. Implemented by the mutable canonical state and by its
 * frozen snapshots, so perception and narration code never needs to know which one it reads.
 */
public interface IWorldReader {

    /**
     * @return The id of the root node.
     */
    String getRootId();

    /**
     * @param id A node id.
     * @return The node, or {@code null} if it does not exist.
     */
    NodeSnapshot getNode(String id);

    /**
     * @param objectId An object id.
     * @return The object's attribute map, empty if the object has no attributes.
     */
    Map<String, String> getObjectState(String objectId);

    /**
     * @param objectId An object id.
     * @return The object's type name, or {@code null} if none was assigned.
     */
    String getObjectType(String objectId);

    /**
     * @param agentId An agent id.
     * @return The area the agent occupies, or {@code null} for unknown agents.
     */
    String getAgentLocation(String agentId);

    /**
     * @param agentId An agent id.
     * @return The agent's movement state.
     */
    TransitState getTransit(String agentId);

    /**
     * @param key An ambient key such as {@code weather}.
     * @return The ambient value, or {@code null} if unset.
     */
    String getAmbient(String key);

    /**
     * @param id A node id.
     * @return The node's display name, or the id itself if the node is unknown.
     */
    default String nameOf(String id) {
        NodeSnapshot node = getNode(id);
        return node != null ? node.name() : id;
    }
}
