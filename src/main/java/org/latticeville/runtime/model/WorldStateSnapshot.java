package org.latticeville.runtime.model;

import java.util.Map;

import org.latticeville.runtime.transit.TransitState;

/**
 * Immutable copy of the canonical state at a tick boundary.
 * <p>
 * This is the frozen snapshot every agent perceives during the decide phase, and the
 * canonical part of each published payload.
 *
 * @param rootId         The root node id.
 * @param nodes          All nodes keyed by id, in tree insertion order.
 * @param objectTypes    Object id to type name.
 * @param objectStates   Object id to attribute map.
 * @param agentLocations Agent id to occupied area id.
 * @param transits       Agents currently travelling; stationary agents are absent.
 * @param ambient        Ambient world values such as weather and clock.
 */
public record WorldStateSnapshot(
        String rootId,
        Map<String, NodeSnapshot> nodes,
        Map<String, String> objectTypes,
        Map<String, Map<String, String>> objectStates,
        Map<String, String> agentLocations,
        Map<String, TransitState.InTransit> transits,
        Map<String, String> ambient) implements IWorldReader {

    public WorldStateSnapshot {
        nodes = FrozenMaps.copyOf(nodes);
        objectTypes = FrozenMaps.copyOf(objectTypes);
        objectStates = FrozenMaps.deepCopyOf(objectStates);
        agentLocations = FrozenMaps.copyOf(agentLocations);
        transits = FrozenMaps.copyOf(transits);
        ambient = FrozenMaps.copyOf(ambient);
    }

    @Override
    public String getRootId() {
        return rootId;
    }

    @Override
    public NodeSnapshot getNode(String id) {
        return nodes.get(id);
    }

    @Override
    public Map<String, String> getObjectState(String objectId) {
        return objectStates.getOrDefault(objectId, Map.of());
    }

    @Override
    public String getObjectType(String objectId) {
        return objectTypes.get(objectId);
    }

    @Override
    public String getAgentLocation(String agentId) {
        return agentLocations.get(agentId);
    }

    @Override
    public TransitState getTransit(String agentId) {
        TransitState.InTransit transit = transits.get(agentId);
        return transit != null ? transit : TransitState.STATIONARY;
    }

    @Override
    public String getAmbient(String key) {
        return ambient.get(key);
    }
}
